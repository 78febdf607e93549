package com.linlay.agentroom.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code <tool_call name="x" k="v">body</tool_call>} invocations from a model reply.
 * Parsing never executes anything; tags without a {@code name} attribute and self-closing tags
 * are dropped. Bodies are kept verbatim, whitespace included.
 */
public final class ToolCallParser {

    private static final Logger log = LoggerFactory.getLogger(ToolCallParser.class);

    // attribute values are quoted and may contain '>'
    private static final Pattern TAG_PATTERN = Pattern.compile(
            "<tool_call((?:\\s+[A-Za-z_][\\w-]*\\s*=\\s*\"[^\"]*\")*)\\s*(?:/>|>(.*?)</tool_call>)",
            Pattern.DOTALL);
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("([A-Za-z_][\\w-]*)\\s*=\\s*\"([^\"]*)\"");
    private static final String NAME_ATTRIBUTE = "name";

    private ToolCallParser() {
    }

    public static List<ToolCall> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        Matcher matcher = TAG_PATTERN.matcher(text);
        while (matcher.find()) {
            String body = matcher.group(2);
            if (body == null) {
                log.debug("Dropping self-closing tool_call tag at offset {}", matcher.start());
                continue;
            }
            Map<String, String> attributes = attributes(matcher.group(1));
            String name = attributes.remove(NAME_ATTRIBUTE);
            if (name == null || name.isBlank()) {
                log.debug("Dropping tool_call tag without a name at offset {}", matcher.start());
                continue;
            }
            calls.add(new ToolCall(name.trim(), attributes, body));
        }
        return calls;
    }

    private static Map<String, String> attributes(String raw) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (raw == null) {
            return attributes;
        }
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(raw);
        while (matcher.find()) {
            attributes.putIfAbsent(matcher.group(1), matcher.group(2));
        }
        return attributes;
    }
}
