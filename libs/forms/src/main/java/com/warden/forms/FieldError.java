package com.warden.forms;

import java.util.List;

/**
 * A single failed binding rule.
 *
 * @param fieldNames     names of the offending fields; the first one is the field the error is reported on
 * @param classification failure class, e.g. {@code RequiredError}
 * @param message        short description, the failing rule as declared
 */
public record FieldError(List<String> fieldNames, String classification, String message) {

    public FieldError {
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }
        fieldNames = List.copyOf(fieldNames);
    }

    public static FieldError of(String fieldName, String classification, String message) {
        return new FieldError(List.of(fieldName), classification, message);
    }

    public String fieldName() {
        return fieldNames.get(0);
    }
}
