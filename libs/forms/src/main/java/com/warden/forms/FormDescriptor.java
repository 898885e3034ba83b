package com.warden.forms;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Declarative description of a form type: an ordered table of its fields.
 * <p>
 * Descriptors are built once, usually as a static constant next to the form type, and are
 * immutable afterwards. Field order is significant: it is the order in which values are
 * validated and assigned.
 *
 * @param <F> form type
 */
public final class FormDescriptor<F> {

    private final String formName;
    private final List<FormField<F>> fields;

    private FormDescriptor(String formName, List<FormField<F>> fields) {
        this.formName = formName;
        this.fields = List.copyOf(fields);
    }

    public static <F> Builder<F> builder(String formName) {
        return new Builder<>(formName);
    }

    public String formName() {
        return formName;
    }

    public List<FormField<F>> fields() {
        return fields;
    }

    public Optional<FormField<F>> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * Builder for {@link FormDescriptor}.
     */
    public static final class Builder<F> {

        private final String formName;
        private final List<FormField<F>> fields = new ArrayList<>();
        private final HashSet<String> names = new HashSet<>();

        private Builder(String formName) {
            if (formName == null || formName.isBlank()) {
                throw new IllegalArgumentException("formName must not be null or blank");
            }
            this.formName = formName;
        }

        /**
         * Adds a bound field.
         *
         * @param name     field name
         * @param formKey  submitted/display key
         * @param binding  rule declaration, e.g. {@code Required;AlphaDashDot;MaxSize(35)}; may be empty
         * @param accessor value reader
         */
        public Builder<F> field(String name, String formKey, String binding, Function<F, Object> accessor) {
            return add(FormField.of(name, formKey, binding, accessor));
        }

        public Builder<F> ignored(String name, Function<F, Object> accessor) {
            return add(FormField.ignored(name, accessor));
        }

        public Builder<F> add(FormField<F> field) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("duplicate field in form %s: %s".formatted(formName, field.name()));
            }
            fields.add(field);
            return this;
        }

        public FormDescriptor<F> build() {
            return new FormDescriptor<>(formName, fields);
        }
    }
}
