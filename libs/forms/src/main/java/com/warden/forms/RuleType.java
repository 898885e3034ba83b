package com.warden.forms;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binding rules a form field can declare, with the classification reported when they fail.
 */
public enum RuleType {

    REQUIRED("Required", "RequiredError", false),
    ALPHA_DASH("AlphaDash", "AlphaDashError", false),
    ALPHA_DASH_DOT("AlphaDashDot", "AlphaDashDotError", false),
    MIN_SIZE("MinSize", "MinSizeError", true),
    MAX_SIZE("MaxSize", "MaxSizeError", true),
    EMAIL("Email", "EmailError", false),
    URL("Url", "UrlError", false),
    RANGE("Range", "RangeError", true);

    private final String declaredName;
    private final String classification;
    private final boolean takesArguments;

    RuleType(String declaredName, String classification, boolean takesArguments) {
        this.declaredName = declaredName;
        this.classification = classification;
        this.takesArguments = takesArguments;
    }

    /**
     * Name used in binding declarations, e.g. {@code MaxSize}.
     */
    public String declaredName() {
        return declaredName;
    }

    /**
     * Classification carried by a {@link FieldError} when this rule fails.
     */
    public String classification() {
        return classification;
    }

    public boolean takesArguments() {
        return takesArguments;
    }

    static Optional<RuleType> forDeclaredName(String name) {
        return Arrays.stream(values()).filter(t -> t.declaredName.equals(name)).findFirst();
    }
}
