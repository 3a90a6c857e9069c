package wikisearch.util;

import java.util.Locale;

public class SnippetBuilder {
    private static final String ELLIPSIS = "...";

    private SnippetBuilder() {
    }

    /**
     * Cuts a window of at most {@code maxLength} characters out of {@code content}, centred on the
     * first case-insensitive occurrence of {@code query}. Falls back to the start of the content.
     */
    public static String build(String content, String query, int maxLength) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String text = content.replaceAll("\\s+", " ").trim();
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }

        int matchStart = query == null || query.isBlank()
                ? -1
                : text.toLowerCase(Locale.ROOT).indexOf(query.trim().toLowerCase(Locale.ROOT));

        int start = 0;
        if (matchStart > 0) {
            start = Math.max(0, matchStart - (maxLength - query.trim().length()) / 2);
            start = Math.min(start, text.length() - maxLength);
        }
        int end = Math.min(text.length(), start + maxLength);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(text, start, end);
        if (end < text.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }
}
