package com.linlay.agentroom.tool;

import com.linlay.agentroom.security.InputValidationException;
import com.linlay.agentroom.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes the tag body to the file named by the {@code path} attribute, creating parent directories.
 */
public class WriteFileTool extends AbstractWorkspaceTool implements FileMutatingTool {

    private static final Logger log = LoggerFactory.getLogger(WriteFileTool.class);

    public WriteFileTool(PathValidator pathValidator) {
        super(pathValidator);
    }

    @Override
    public String name() {
        return "write_file";
    }

    @Override
    public String description() {
        return "Write content to a file. Provide 'path' as an attribute and the content via tag body.";
    }

    @Override
    public String primaryArgument() {
        return "content";
    }

    @Override
    public String invoke(Map<String, String> args) {
        String rawPath = argument(args, "path");
        if (rawPath.isEmpty()) {
            return "Error: Missing argument: path";
        }
        String content = args.getOrDefault("content", "");
        try {
            Path path = pathValidator.resolve(rawPath);
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.info("Wrote {} chars to {}", content.length(), path);
            return "Successfully wrote to " + rawPath;
        } catch (InputValidationException | IOException ex) {
            return "Error writing file: " + ex.getMessage();
        }
    }

    /**
     * @throws InputValidationException when the path is missing or rejected
     */
    @Override
    public FileChangePreview preview(Map<String, String> args) {
        String rawPath = argument(args, "path");
        if (rawPath.isEmpty()) {
            throw new InputValidationException("Missing argument: path");
        }
        Path path = pathValidator.resolve(rawPath);
        boolean existed = Files.isRegularFile(path);
        String oldContent;
        try {
            oldContent = existed ? Files.readString(path, StandardCharsets.UTF_8) : "";
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        String newContent = args.getOrDefault("content", "");
        UnifiedDiff diff = UnifiedDiff.between(oldContent, newContent);
        return new FileChangePreview(
                pathValidator.relativize(path),
                existed,
                oldContent,
                newContent,
                diff.format(pathValidator.relativize(path)),
                diff.addedLines(),
                diff.removedLines()
        );
    }
}
