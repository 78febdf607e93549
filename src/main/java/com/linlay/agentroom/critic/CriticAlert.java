package com.linlay.agentroom.critic;

import java.util.Optional;

public record CriticAlert(
        String targetAgent,
        String severity,
        String issue,
        String fix
) {

    static final String ALERT_MARKER = "STATUS: ALERT";

    /**
     * Reads the {@code SEVERITY:}, {@code ISSUE:} and {@code FIX:} lines of an alert reply.
     *
     * @return empty when the reply does not raise an alert
     */
    public static Optional<CriticAlert> parse(String targetAgent, String reply) {
        if (reply == null || !reply.contains(ALERT_MARKER)) {
            return Optional.empty();
        }
        String severity = "MAJOR";
        String issue = "Unknown issue";
        String fix = "Check logs";
        for (String line : reply.split("\\R")) {
            if (line.contains("SEVERITY:")) {
                severity = valueOf(line);
            }
            if (line.contains("ISSUE:")) {
                issue = valueOf(line);
            }
            if (line.contains("FIX:")) {
                fix = valueOf(line);
            }
        }
        return Optional.of(new CriticAlert(targetAgent, severity, issue, fix));
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).strip().replaceAll("^\"|\"$", "");
    }
}
