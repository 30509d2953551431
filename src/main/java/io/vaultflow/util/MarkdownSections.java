package io.vaultflow.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MarkdownSections {
    private MarkdownSections() {
    }

    /**
     * Returns the text under {@code ## header} up to the next level-two header, or an empty string.
     */
    public static String extract(String body, String header) {
        if (body == null || body.isBlank() || header == null || header.isBlank()) {
            return "";
        }
        Pattern pattern = Pattern.compile(
                "^## " + Pattern.quote(header.trim()) + "[ \\t]*\\R(.*?)(?=^## |\\z)",
                Pattern.MULTILINE | Pattern.DOTALL
        );
        Matcher matcher = pattern.matcher(body);
        return matcher.find() ? matcher.group(1).strip() : "";
    }
}
