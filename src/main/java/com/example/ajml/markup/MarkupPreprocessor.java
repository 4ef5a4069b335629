package com.example.ajml.markup;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escapes characters that strict XML rejects inside {@code <condition>} and {@code <system_prompt>}
 * so authors can write {@code state["n"] < 3} without entity escaping.
 */
public final class MarkupPreprocessor {

    private static final List<String> RAW_CONTENT_TAGS = List.of("condition", "system_prompt");
    private static final Pattern BARE_AMPERSAND = Pattern.compile("&(?!amp;|lt;|gt;|apos;|quot;|#)");
    private static final Pattern OPENING_ANGLE = Pattern.compile("<(?!/)");

    private MarkupPreprocessor() {
    }

    public static String preprocess(String raw) {
        String sanitised = raw;
        for (String tag : RAW_CONTENT_TAGS) {
            sanitised = escapeTagContent(sanitised, tag);
        }
        return sanitised;
    }

    private static String escapeTagContent(String raw, String tag) {
        Pattern pattern = Pattern.compile("(<" + tag + ">)(.*?)(</" + tag + ">)", Pattern.DOTALL);
        Matcher matcher = pattern.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = matcher.group(1) + escapeContent(matcher.group(2)) + matcher.group(3);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String escapeContent(String text) {
        String escaped = BARE_AMPERSAND.matcher(text).replaceAll("&amp;");
        escaped = OPENING_ANGLE.matcher(escaped).replaceAll("&lt;");
        return escaped.replace(">", "&gt;");
    }
}
