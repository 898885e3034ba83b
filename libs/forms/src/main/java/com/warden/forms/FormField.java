package com.warden.forms;

import java.util.List;
import java.util.function.Function;

/**
 * A field of a form type: its name, the key it is submitted and displayed under, its
 * binding rules, and how to read its value.
 *
 * @param name     field name, used for error flags ({@code Err_<name>}) and label translation ({@code form.<name>})
 * @param formKey  key under which the value is submitted and assigned to template data; {@value #IGNORED} skips the field
 * @param rules    parsed binding rules, in declaration order
 * @param accessor reads the field's current value from a form instance
 * @param <F>      form type
 */
public record FormField<F>(
        String name,
        String formKey,
        List<BindingRule> rules,
        Function<F, Object> accessor
) {

    /** Form key marking a field that is neither bound nor assigned back. */
    public static final String IGNORED = "-";

    public FormField {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (formKey == null || formKey.isBlank()) {
            throw new IllegalArgumentException("formKey must not be null or blank");
        }
        if (accessor == null) {
            throw new IllegalArgumentException("accessor must not be null");
        }
        rules = List.copyOf(rules);
    }

    /**
     * Creates a field from a binding declaration such as {@code Required;MaxSize(35)}.
     */
    public static <F> FormField<F> of(String name, String formKey, String binding, Function<F, Object> accessor) {
        return new FormField<>(name, formKey, BindingRule.parseAll(binding), accessor);
    }

    /**
     * Creates a field that is skipped by binding, validation and assignment.
     */
    public static <F> FormField<F> ignored(String name, Function<F, Object> accessor) {
        return new FormField<>(name, IGNORED, List.of(), accessor);
    }

    public boolean isIgnored() {
        return IGNORED.equals(formKey);
    }

    public Object valueOf(F form) {
        return accessor.apply(form);
    }

    /**
     * Bound declared by {@code MinSize(n)}, or an empty string.
     */
    public String minSize() {
        return bound(RuleType.MIN_SIZE);
    }

    /**
     * Bound declared by {@code MaxSize(n)}, or an empty string.
     */
    public String maxSize() {
        return bound(RuleType.MAX_SIZE);
    }

    private String bound(RuleType type) {
        return rules.stream()
                .filter(rule -> rule.type() == type)
                .map(BindingRule::bound)
                .findFirst()
                .orElse("");
    }
}
