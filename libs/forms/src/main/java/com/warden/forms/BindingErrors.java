package com.warden.forms;

import java.util.List;
import java.util.Optional;

/**
 * Errors found while binding a form, in field declaration order.
 *
 * @param errors the errors; empty when the form is valid
 */
public record BindingErrors(List<FieldError> errors) {

    private static final BindingErrors NONE = new BindingErrors(List.of());

    public BindingErrors {
        errors = List.copyOf(errors);
    }

    public static BindingErrors none() {
        return NONE;
    }

    public static BindingErrors of(FieldError... errors) {
        return new BindingErrors(List.of(errors));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public Optional<FieldError> first() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }
}
