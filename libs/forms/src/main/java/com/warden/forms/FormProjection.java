package com.warden.forms;

import org.springframework.context.MessageSource;

import java.util.Locale;
import java.util.Map;

/**
 * Projects a form and its binding errors into template data.
 * <p>
 * After a failed submission the template needs the values the user typed, a flag on the
 * offending field and a localized message. Only the first error is reported: a form with
 * three invalid fields shows one message, and the user fixes them one submission at a time.
 * <p>
 * Keys written to the data map:
 * <ul>
 *   <li>{@code <formKey>} for every non-ignored field: its current value</li>
 *   <li>{@value #HAS_ERROR}: {@code true} when there is at least one error</li>
 *   <li>{@code Err_<FieldName>}: {@code true} for the field of the first error</li>
 *   <li>{@value #ERROR_MSG}: localized message for the first error</li>
 * </ul>
 * Messages are looked up in a Spring {@link MessageSource}; a missing message renders as its code.
 */
public class FormProjection {

    public static final String HAS_ERROR = "HasError";
    public static final String ERROR_MSG = "ErrorMsg";
    public static final String FIELD_ERROR_PREFIX = "Err_";

    static final String LABEL_PREFIX = "form.";
    static final String REQUIRE_ERROR = "form.require_error";
    static final String ALPHA_DASH_ERROR = "form.alpha_dash_error";
    static final String ALPHA_DASH_DOT_ERROR = "form.alpha_dash_dot_error";
    static final String MIN_SIZE_ERROR = "form.min_size_error";
    static final String MAX_SIZE_ERROR = "form.max_size_error";
    static final String EMAIL_ERROR = "form.email_error";
    static final String URL_ERROR = "form.url_error";
    static final String UNKNOWN_ERROR = "form.unknown_error";

    private final MessageSource messages;

    public FormProjection(MessageSource messages) {
        if (messages == null) {
            throw new IllegalArgumentException("messages must not be null");
        }
        this.messages = messages;
    }

    /**
     * Copies the value of every non-ignored field into {@code data}, keyed by its form key.
     */
    public static <F> void assignForm(FormDescriptor<F> descriptor, F form, Map<String, Object> data) {
        for (FormField<F> field : descriptor.fields()) {
            if (field.isIgnored()) {
                continue;
            }
            data.put(field.formKey(), field.valueOf(form));
        }
    }

    /**
     * Writes the form values and the first error into {@code data}. Leaves {@code data}
     * untouched when there are no errors.
     *
     * @return {@code errors}, unchanged
     */
    public <F> BindingErrors project(
            FormDescriptor<F> descriptor, F form, BindingErrors errors, Map<String, Object> data, Locale locale) {
        if (errors.isEmpty()) {
            return errors;
        }

        data.put(HAS_ERROR, true);
        assignForm(descriptor, form, data);

        FieldError first = errors.first().orElseThrow();
        for (FormField<F> field : descriptor.fields()) {
            if (field.isIgnored() || !field.name().equals(first.fieldName())) {
                continue;
            }
            data.put(FIELD_ERROR_PREFIX + field.name(), true);
            data.put(ERROR_MSG, errorMessage(field, first.classification(), locale));
            return errors;
        }
        return errors;
    }

    /**
     * Writes the form values and a single message into {@code data} for a failure found
     * after binding, such as a wrong password or a taken user name.
     *
     * @param fieldName   field to flag with {@code Err_<fieldName>}, or null to flag none
     * @param messageCode message code of the full error message
     */
    public <F> void reject(
            FormDescriptor<F> descriptor,
            F form,
            String fieldName,
            String messageCode,
            Map<String, Object> data,
            Locale locale) {
        data.put(HAS_ERROR, true);
        assignForm(descriptor, form, data);
        if (fieldName != null) {
            data.put(FIELD_ERROR_PREFIX + fieldName, true);
        }
        data.put(ERROR_MSG, tr(messageCode, locale));
    }

    private String errorMessage(FormField<?> field, String classification, Locale locale) {
        String label = tr(LABEL_PREFIX + field.name(), locale);
        return switch (classification) {
            case "RequiredError" -> label + tr(REQUIRE_ERROR, locale);
            case "AlphaDashError" -> label + tr(ALPHA_DASH_ERROR, locale);
            case "AlphaDashDotError" -> label + tr(ALPHA_DASH_DOT_ERROR, locale);
            case "MinSizeError" -> label + tr(MIN_SIZE_ERROR, locale, field.minSize());
            case "MaxSizeError" -> label + tr(MAX_SIZE_ERROR, locale, field.maxSize());
            case "EmailError" -> label + tr(EMAIL_ERROR, locale);
            case "UrlError" -> label + tr(URL_ERROR, locale);
            default -> tr(UNKNOWN_ERROR, locale) + " " + classification;
        };
    }

    private String tr(String code, Locale locale, Object... args) {
        return messages.getMessage(code, args, code, locale);
    }
}
