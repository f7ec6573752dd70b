package pl.marcinmilkowski.usas_eval.dataset;

import java.util.Locale;

/**
 * Granularity of the texts held by a dataset.
 */
public enum TextLevel {
    SENTENCE,
    PARAGRAPH,
    DOCUMENT;

    /**
     * Lower-case name used in exported datasets, e.g. {@code sentence}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TextLevel fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Text level must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
