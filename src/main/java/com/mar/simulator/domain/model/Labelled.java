package com.mar.simulator.domain.model;

import java.util.Locale;

/**
 * Policy enums that are also addressed by the human labels used in configuration
 * ("As new unit", "Using ATR", ...). Lookups accept either the label or the constant name.
 */
public interface Labelled {

    String label();

    static <E extends Enum<E> & Labelled> E parse(Class<E> type, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Missing value for " + type.getSimpleName());
        }
        String wanted = normalize(text);
        for (E e : type.getEnumConstants()) {
            if (normalize(e.name()).equals(wanted) || normalize(e.label()).equals(wanted)) return e;
        }
        throw new IllegalArgumentException("Unrecognized " + type.getSimpleName() + ": '" + text + "'");
    }

    private static String normalize(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (Character.isLetterOrDigit(c)) sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
