package com.newsrelay.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers for feed entry fields, which routinely arrive as escaped HTML.
 */
public final class FeedText {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"')\\]]+", Pattern.CASE_INSENSITIVE);
    private static final String[] IMAGE_EXTENSIONS = {".jpg", ".jpeg", ".png", ".gif", ".webp"};

    private FeedText() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** First argument that is not null or blank, trimmed; empty string if none. */
    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return "";
    }

    /**
     * Markup stripped, entities decoded, whitespace collapsed.
     */
    public static String toPlainText(String html) {
        if (isBlank(html)) {
            return "";
        }
        if (html.indexOf('<') < 0 && html.indexOf('&') < 0) {
            return html.replaceAll("\\s+", " ").trim();
        }
        return Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
    }

    /**
     * First {@code <a href>} target in the HTML, else the first http(s) URL in its text.
     */
    public static String firstLink(String html) {
        if (isBlank(html)) {
            return null;
        }
        if (html.indexOf('<') >= 0) {
            Element anchor = Jsoup.parse(html).selectFirst("a[href^=http]");
            if (anchor != null) {
                return anchor.attr("href").trim();
            }
        }
        Matcher matcher = URL_PATTERN.matcher(html);
        return matcher.find() ? stripTrailingPunctuation(matcher.group()) : null;
    }

    /** {@code src} of the first {@code <img>} in the HTML. */
    public static String firstImage(String html) {
        if (isBlank(html) || html.indexOf('<') < 0) {
            return null;
        }
        Document doc = Jsoup.parse(html);
        Element img = doc.selectFirst("img[src^=http]");
        return img != null ? img.attr("src").trim() : null;
    }

    public static boolean looksLikeImage(String url) {
        if (isBlank(url)) {
            return false;
        }
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        for (String ext : IMAGE_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 1)).trim() + "…";
    }

    private static String stripTrailingPunctuation(String url) {
        return url.replaceAll("[.,;:!?]+$", "");
    }
}
