package com.linlay.agentroom.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code @name} tags from free text.
 */
public final class MentionParser {

    private static final Pattern MENTION_PATTERN = Pattern.compile("@([A-Za-z0-9_]+)");

    private MentionParser() {
    }

    /**
     * Names in order of appearance, without the leading {@code @}. Duplicates are kept.
     */
    public static List<String> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> mentions = new ArrayList<>();
        Matcher matcher = MENTION_PATTERN.matcher(text);
        while (matcher.find()) {
            mentions.add(matcher.group(1));
        }
        return mentions;
    }

    /**
     * Removes every {@code @name} occurrence that is not the prefix of a longer name.
     */
    public static String strip(String text, String mention) {
        Pattern literal = Pattern.compile("@" + Pattern.quote(mention) + "(?![A-Za-z0-9_])");
        return literal.matcher(text).replaceAll("");
    }
}
