package com.linlay.agentroom.tool;

/**
 * Proposed file change shown to the operator before a write is confirmed.
 *
 * @param existed    whether the target file exists today
 * @param oldContent current content, empty for a new file
 */
public record FileChangePreview(
        String path,
        boolean existed,
        String oldContent,
        String newContent,
        String unifiedDiff,
        int addedLines,
        int removedLines
) {

    public boolean hasChanges() {
        return !unifiedDiff.isEmpty();
    }
}
