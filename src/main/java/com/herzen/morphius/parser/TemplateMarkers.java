package com.herzen.morphius.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TemplateMarkers {
    public static final String IDENTIFIER = "[A-Za-z][A-Za-z0-9_]*";

    public static final Pattern QUESTION = Pattern.compile("(?s)\\|<q>(.*?)</q>\\|");
    public static final Pattern QUESTION_WITH_ANSWER = Pattern.compile("(?s)\\|<q>(.*?)</q>\\|\\s*\\|<a>(.*?)</a>\\|");
    public static final Pattern EXPRESSION = Pattern.compile("\\|<e>(.*?)</e>\\|");
    public static final Pattern DECLARATION = Pattern.compile(
            "\\|<v>(" + IDENTIFIER + "):\\s*([A-Za-z]*)\\s*=\\s*\\[(-?[0-9]+),(-?[0-9]+)\\]</v>\\|");
    public static final Pattern ANY_DECLARATION = Pattern.compile("\\|<v>(.*?)</v>\\|");
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER);

    private TemplateMarkers() {}

    // keeps empty leading, inner and trailing segments
    public static List<String> split(Pattern pattern, String text) {
        List<String> parts = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        int last = 0;
        while (matcher.find()) {
            parts.add(text.substring(last, matcher.start()));
            last = matcher.end();
        }
        parts.add(text.substring(last));
        return parts;
    }

    public static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }
}
