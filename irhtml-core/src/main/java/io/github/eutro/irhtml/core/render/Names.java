package io.github.eutro.irhtml.core.render;

import java.nio.charset.StandardCharsets;

/**
 * Spelling of identifiers and string literals.
 */
public final class Names {
    private Names() {
    }

    /**
     * Spell a name with its sigil, quoting it if it contains anything but
     * {@code [-a-zA-Z$._0-9]} or starts with a digit.
     *
     * @param sigil The sigil, {@code %} or {@code @}.
     * @param name  The name.
     * @return The identifier.
     */
    public static String identifier(char sigil, String name) {
        StringBuilder sb = new StringBuilder().append(sigil);
        if (isBare(name)) {
            return sb.append(name).toString();
        }
        sb.append('"');
        escapeTo(sb, name);
        return sb.append('"').toString();
    }

    private static boolean isBare(String name) {
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) return false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = c >= 'a' && c <= 'z'
                    || c >= 'A' && c <= 'Z'
                    || c >= '0' && c <= '9'
                    || c == '-' || c == '$' || c == '.' || c == '_';
            if (!ok) return false;
        }
        return true;
    }

    /**
     * Spell a string literal, without the quotes. Quotes, backslashes and anything
     * non-printable are written as {@code \XX}, two hex digits per UTF-8 byte.
     *
     * @param sb   The builder to append to.
     * @param text The text.
     */
    public static void escapeTo(StringBuilder sb, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append('\\')
                        .append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
    }

    public static String quoted(String text) {
        StringBuilder sb = new StringBuilder().append('"');
        escapeTo(sb, text);
        return sb.append('"').toString();
    }
}
