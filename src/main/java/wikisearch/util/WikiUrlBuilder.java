package wikisearch.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

public class WikiUrlBuilder {
    private static final String ARTICLE_PATH = "/wiki/";

    private WikiUrlBuilder() {
    }

    public static String buildArticleUrl(String scheme, String host, String term) {
        return scheme + "://" + host + ARTICLE_PATH + toSlug(term);
    }

    /**
     * Turns a search term into an article slug: spaces become underscores and every word
     * is title-cased. Underscores do not split a word, and neither do {@code .}, {@code :}
     * or {@code '} between two letters, so {@code "python programming"} becomes
     * {@code "Python_programming"} and {@code "node.js"} becomes {@code "Node.js"}.
     * The first cased letter of a word is the one upper-cased ({@code "3d"} becomes {@code "3D"}).
     */
    public static String toSlug(String term) {
        String underscored = term.replace(' ', '_');
        StringBuilder slug = new StringBuilder(underscored.length());
        boolean awaitingCased = true;
        int i = 0;
        while (i < underscored.length()) {
            int codePoint = underscored.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            if (isWordPart(codePoint) || isMidWord(underscored, i, codePoint, next)) {
                if (awaitingCased && isCased(codePoint)) {
                    slug.appendCodePoint(Character.toTitleCase(codePoint));
                    awaitingCased = false;
                } else {
                    slug.appendCodePoint(awaitingCased ? codePoint : Character.toLowerCase(codePoint));
                }
            } else {
                slug.appendCodePoint(codePoint);
                awaitingCased = true;
            }
            i = next;
        }
        return slug.toString();
    }

    public static String getHost(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            // article slugs may hold characters URI rejects, URL is more lenient
            try {
                return new URL(url).getHost();
            } catch (MalformedURLException ex) {
                return null;
            }
        }
    }

    public static String resolve(String baseUrl, String location) {
        try {
            return new URI(baseUrl).resolve(location).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return location;
        }
    }

    private static boolean isWordPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }

    private static boolean isMidWord(String text, int index, int codePoint, int next) {
        if (codePoint != '.' && codePoint != ':' && codePoint != '\'') {
            return false;
        }
        return index > 0 && next < text.length()
                && Character.isLetter(text.codePointBefore(index))
                && Character.isLetter(text.codePointAt(next));
    }

    private static boolean isCased(int codePoint) {
        return Character.isUpperCase(codePoint) || Character.isLowerCase(codePoint) || Character.isTitleCase(codePoint);
    }
}
