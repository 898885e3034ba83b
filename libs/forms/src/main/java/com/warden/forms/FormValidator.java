package com.warden.forms;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks a form instance against the binding rules of its {@link FormDescriptor}.
 * <p>
 * Every field is checked, in declaration order, and at most one error is recorded per
 * field: the first rule it fails. Ignored fields are skipped. An empty value fails
 * {@code Required} wherever it is declared, and skips every other rule.
 */
public final class FormValidator {

    private static final Pattern ALPHA_DASH = Pattern.compile("[^\\w-]");
    private static final Pattern ALPHA_DASH_DOT = Pattern.compile("[^\\w.-]");
    private static final Pattern EMAIL = Pattern.compile(
            "[\\w!#$%&'*+/=?^_`{|}~-]+(?:\\.[\\w!#$%&'*+/=?^_`{|}~-]+)*"
                    + "@(?:[\\w](?:[\\w-]*[\\w])?\\.)+[a-zA-Z0-9](?:[\\w-]*[\\w])?");
    private static final Pattern URL = Pattern.compile(
            "(?i)^(?:https?|ftp)://[^\\s/$.?#][^\\s]*$");

    private FormValidator() {
        // utility class
    }

    /**
     * Validates every non-ignored field of {@code form}.
     *
     * @param descriptor the form's field table
     * @param form       the bound form instance
     * @return the errors found, in field declaration order
     */
    public static <F> BindingErrors validate(FormDescriptor<F> descriptor, F form) {
        var errors = new ArrayList<FieldError>();
        for (FormField<F> field : descriptor.fields()) {
            if (field.isIgnored()) {
                continue;
            }
            Object value = field.valueOf(form);
            if (isEmpty(value)) {
                if (isRequired(field)) {
                    errors.add(FieldError.of(field.name(), RuleType.REQUIRED.classification(),
                            RuleType.REQUIRED.declaredName()));
                }
                continue;
            }
            for (BindingRule rule : field.rules()) {
                if (!satisfies(rule, value)) {
                    errors.add(FieldError.of(field.name(), rule.type().classification(), rule.declaration()));
                    break;
                }
            }
        }
        return errors.isEmpty() ? BindingErrors.none() : new BindingErrors(errors);
    }

    private static boolean isRequired(FormField<?> field) {
        return field.rules().stream().anyMatch(r -> r.type() == RuleType.REQUIRED);
    }

    private static boolean satisfies(BindingRule rule, Object value) {
        return switch (rule.type()) {
            case REQUIRED -> !isEmpty(value);
            case ALPHA_DASH -> !ALPHA_DASH.matcher(text(value)).find();
            case ALPHA_DASH_DOT -> !ALPHA_DASH_DOT.matcher(text(value)).find();
            case MIN_SIZE -> size(value) >= rule.intArgument(0);
            case MAX_SIZE -> size(value) <= rule.intArgument(0);
            case EMAIL -> EMAIL.matcher(text(value)).matches();
            case URL -> URL.matcher(text(value)).matches();
            case RANGE -> inRange(value, rule.intArgument(0), rule.intArgument(1));
        };
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Characters (code points) for text, elements for collections.
     */
    private static int size(Object value) {
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        String s = text(value);
        return s.codePointCount(0, s.length());
    }

    private static boolean inRange(Object value, int min, int max) {
        BigDecimal number;
        try {
            number = value instanceof Number n ? new BigDecimal(n.toString()) : new BigDecimal(text(value).strip());
        } catch (NumberFormatException e) {
            return false;
        }
        return number.compareTo(BigDecimal.valueOf(min)) >= 0 && number.compareTo(BigDecimal.valueOf(max)) <= 0;
    }
}
