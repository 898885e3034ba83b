package com.warden.forms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One rule from a field's binding declaration, e.g. {@code MaxSize(35)}.
 *
 * @param type        the rule
 * @param declaration the rule text as declared
 * @param arguments   the comma-separated arguments inside the parentheses, trimmed; empty for plain rules
 */
public record BindingRule(RuleType type, String declaration, List<String> arguments) {

    public BindingRule {
        arguments = List.copyOf(arguments);
    }

    /**
     * Parses a declaration such as {@code Required;AlphaDashDot;MaxSize(35)}.
     *
     * @param declaration semicolon-separated rules; null or blank means no rules
     * @return the rules in declaration order
     * @throws IllegalArgumentException if a rule is unknown or its arguments are malformed
     */
    public static List<BindingRule> parseAll(String declaration) {
        if (declaration == null || declaration.isBlank()) {
            return List.of();
        }
        var rules = new ArrayList<BindingRule>();
        for (String part : declaration.split(";")) {
            String text = part.strip();
            if (!text.isEmpty()) {
                rules.add(parse(text));
            }
        }
        return List.copyOf(rules);
    }

    /**
     * Parses a single rule declaration.
     *
     * @throws IllegalArgumentException if the rule is unknown or its arguments are malformed
     */
    public static BindingRule parse(String text) {
        int open = text.indexOf('(');
        String name = open < 0 ? text : text.substring(0, open);
        RuleType type = RuleType.forDeclaredName(name)
                .orElseThrow(() -> new IllegalArgumentException("unknown binding rule: " + text));

        if (!type.takesArguments()) {
            if (open >= 0) {
                throw new IllegalArgumentException("binding rule takes no arguments: " + text);
            }
            return new BindingRule(type, text, List.of());
        }

        if (open < 0 || !text.endsWith(")")) {
            throw new IllegalArgumentException("binding rule requires arguments: " + text);
        }
        List<String> arguments = Arrays.stream(text.substring(open + 1, text.length() - 1).split(","))
                .map(String::strip)
                .toList();
        int expected = type == RuleType.RANGE ? 2 : 1;
        if (arguments.size() != expected) {
            throw new IllegalArgumentException("binding rule expects %d argument(s): %s".formatted(expected, text));
        }
        for (String argument : arguments) {
            try {
                Integer.parseInt(argument);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("binding rule argument is not a number: " + text, e);
            }
        }
        return new BindingRule(type, text, arguments);
    }

    /**
     * The first argument as text, e.g. {@code "35"} for {@code MaxSize(35)}; empty for plain rules.
     */
    public String bound() {
        return arguments.isEmpty() ? "" : arguments.get(0);
    }

    int intArgument(int index) {
        return Integer.parseInt(arguments.get(index));
    }
}
