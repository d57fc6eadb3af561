package org.camunda.bpm.getstarted.bpmnlayout.models;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inner padding of a container, in the order ELK writes it: {@code [top=..,left=..,bottom=..,right=..]}.
 */
public record Padding(double top, double left, double bottom, double right) {
    private static final Pattern ENTRY = Pattern.compile("(top|left|bottom|right)\\s*=\\s*(-?[0-9.]+)");

    public static Padding uniform(double value) {
        return new Padding(value, value, value, value);
    }

    /**
     * Parses {@code [top=12,left=30,bottom=12,right=12]}. Missing sides default to 0, a plain
     * number is applied to all four sides.
     *
     * @throws IllegalArgumentException if the value is neither form
     */
    public static Padding parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Padding value is empty");
        }
        String trimmed = value.trim();
        if (!trimmed.startsWith("[")) {
            try {
                return uniform(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid padding value: " + value, e);
            }
        }

        double top = 0, left = 0, bottom = 0, right = 0;
        Matcher matcher = ENTRY.matcher(trimmed);
        boolean found = false;
        while (matcher.find()) {
            found = true;
            double amount = Double.parseDouble(matcher.group(2));
            switch (matcher.group(1)) {
                case "top" -> top = amount;
                case "left" -> left = amount;
                case "bottom" -> bottom = amount;
                default -> right = amount;
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Invalid padding value: " + value);
        }
        return new Padding(top, left, bottom, right);
    }

    public String toOptionValue() {
        return String.format("[top=%s,left=%s,bottom=%s,right=%s]", fmt(top), fmt(left), fmt(bottom), fmt(right));
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
