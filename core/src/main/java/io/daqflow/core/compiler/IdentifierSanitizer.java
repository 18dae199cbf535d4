package io.daqflow.core.compiler;

import java.util.Locale;

/**
 * Derives Python identifiers from free-form labels.
 *
 * <p>The label is lowercased, every character outside {@code [a-z0-9_]} becomes {@code _}, runs
 * of {@code _} collapse to one, and a leading digit gets a {@code _} prefix. A label with no
 * representable word content (no ASCII letter survives) falls back to {@code component_<id>}.
 * The result is always a valid identifier and sanitizing it again returns it unchanged.
 */
public final class IdentifierSanitizer {

    static final String FALLBACK_PREFIX = "component_";

    private IdentifierSanitizer() {}

    /**
     * Sanitizes a label, falling back to an id-derived name.
     *
     * @param label      free-form label, may be {@code null} or empty
     * @param fallbackId id used when the label yields no usable identifier
     * @return a valid Python identifier
     */
    public static String sanitize(String label, String fallbackId) {
        String candidate = label == null ? "" : clean(label);
        if (hasAsciiLetter(candidate)) {
            return candidate;
        }
        String id = fallbackId == null ? "" : fallbackId;
        return clean(FALLBACK_PREFIX + id);
    }

    /** Sanitizes a label with {@code component} as the last-resort name. */
    public static String sanitize(String label) {
        String candidate = label == null ? "" : clean(label);
        return hasAsciiLetter(candidate) ? candidate : "component";
    }

    private static String clean(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(lower.length());
        lower.codePoints().forEach(cp -> {
            boolean word = (cp >= 'a' && cp <= 'z') || (cp >= '0' && cp <= '9') || cp == '_';
            char c = word ? (char) cp : '_';
            if (c == '_' && out.length() > 0 && out.charAt(out.length() - 1) == '_') {
                return;
            }
            out.append(c);
        });
        if (out.length() > 0 && Character.isDigit(out.charAt(0))) {
            out.insert(0, '_');
        }
        return out.toString();
    }

    private static boolean hasAsciiLetter(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'a' && c <= 'z') {
                return true;
            }
        }
        return false;
    }
}
