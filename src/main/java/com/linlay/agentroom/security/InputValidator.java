package com.linlay.agentroom.security;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates operator input before it reaches the orchestration core.
 */
@Component
public class InputValidator {

    public static final int MAX_MESSAGE_CHARS = 50_000;
    public static final int MAX_MESSAGE_LINES = 1_000;
    public static final int MAX_NAME_CHARS = 50;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{4,}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Set<String> RESERVED_ROOM_NAMES = Set.of(".", "..", "con", "prn", "aux", "nul");

    /**
     * @return the content with runs of four or more newlines collapsed to three
     */
    public String validateMessage(String content) {
        if (content == null || content.isEmpty()) {
            throw new InputValidationException("Message must not be empty");
        }
        if (content.length() > MAX_MESSAGE_CHARS) {
            throw new InputValidationException("Message cannot exceed " + MAX_MESSAGE_CHARS + " characters");
        }
        if (content.indexOf('\0') >= 0) {
            throw new InputValidationException("Message cannot contain null bytes");
        }
        if (content.split("\n", -1).length > MAX_MESSAGE_LINES) {
            throw new InputValidationException("Message cannot exceed " + MAX_MESSAGE_LINES + " lines");
        }
        return EXCESS_NEWLINES.matcher(content).replaceAll("\n\n\n");
    }

    public String validateAgentName(String name) {
        return validateName("Agent name", name);
    }

    public String validateRoomName(String name) {
        String valid = validateName("Room name", name);
        if (RESERVED_ROOM_NAMES.contains(valid.toLowerCase(Locale.ROOT))) {
            throw new InputValidationException("Room name '" + valid + "' is reserved");
        }
        return valid;
    }

    private String validateName(String label, String name) {
        if (name == null || name.isEmpty()) {
            throw new InputValidationException(label + " must not be empty");
        }
        if (name.length() > MAX_NAME_CHARS) {
            throw new InputValidationException(label + " cannot exceed " + MAX_NAME_CHARS + " characters");
        }
        if (name.indexOf('\0') >= 0) {
            throw new InputValidationException(label + " cannot contain null bytes");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new InputValidationException(label + " can only contain letters, numbers, hyphens, and underscores");
        }
        return name;
    }

    /**
     * Strips control characters, collapses whitespace and truncates to {@code maxLength}
     * (with a trailing "...").
     */
    public static String sanitizeForDisplay(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String sanitized = CONTROL_CHARS.matcher(text).replaceAll("");
        sanitized = String.join(" ", sanitized.trim().split("\\s+")).trim();
        if (sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength) + "...";
        }
        return sanitized;
    }

    public static String sanitizeForDisplay(String text) {
        return sanitizeForDisplay(text, 100);
    }
}
