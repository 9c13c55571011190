package com.tsplate;

/**
 * Escapes text for embedding inside a double-quoted TypeScript string literal.
 * Every character that would end the literal or the line is escaped.
 */
public final class SafeString {

    private SafeString() {
    }

    public static String escape(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\u2028", "\\u2028")
            .replace("\u2029", "\\u2029");
    }

    /**
     * Inverse of {@link #escape(String)}.
     */
    public static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'u' -> {
                    if (isHex(value, i + 1, 4)) {
                        sb.append((char) Integer.parseInt(value.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        sb.append(c).append(next);
                    }
                }
                default -> sb.append(c).append(next);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(String value, int from, int count) {
        if (from + count > value.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
