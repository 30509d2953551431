package io.vaultflow.util;

/**
 * Identifier rules shared by records, owners and roles.
 *
 * <p>Record ids become file names, so only a conservative character set is accepted.
 */
public final class Ids {
    public static final int MAX_LENGTH = 128;

    private Ids() {
    }

    public static boolean isValid(String raw) {
        if (raw == null || raw.isEmpty() || raw.length() > MAX_LENGTH) {
            return false;
        }
        if (raw.startsWith(".")) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    public static String require(String raw, String what) {
        if (!isValid(raw)) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw);
        }
        return raw;
    }

    /**
     * Turns an arbitrary label (a dropped file name, a chat handle) into a valid id.
     */
    public static String sanitize(String raw) {
        String normalized = raw == null ? "" : raw.trim();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length() && sb.length() < MAX_LENGTH; i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        String value = sb.toString();
        while (value.startsWith(".")) {
            value = value.substring(1);
        }
        return value.isEmpty() ? "item" : value;
    }
}
