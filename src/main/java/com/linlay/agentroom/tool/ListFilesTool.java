package com.linlay.agentroom.tool;

import com.linlay.agentroom.security.InputValidationException;
import com.linlay.agentroom.security.PathValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class ListFilesTool extends AbstractWorkspaceTool {

    public ListFilesTool(PathValidator pathValidator) {
        super(pathValidator);
    }

    @Override
    public String name() {
        return "list_files";
    }

    @Override
    public String description() {
        return "List files in a directory. Provide the path as the tool argument.";
    }

    @Override
    public String primaryArgument() {
        return "path";
    }

    @Override
    public String invoke(Map<String, String> args) {
        String rawPath = argument(args, "path");
        if (rawPath.isEmpty()) {
            rawPath = ".";
        }
        try {
            Path directory = pathValidator.resolve(rawPath);
            if (!Files.exists(directory)) {
                return "Error: Directory '" + rawPath + "' does not exist.";
            }
            if (!Files.isDirectory(directory)) {
                return "Error: '" + rawPath + "' is not a directory.";
            }
            List<String> entries;
            try (Stream<Path> stream = Files.list(directory)) {
                entries = stream
                        .map(item -> item.getFileName() + (Files.isDirectory(item) ? "/" : ""))
                        .sorted()
                        .toList();
            }
            return entries.isEmpty() ? "Directory is empty." : String.join("\n", entries);
        } catch (InputValidationException | IOException ex) {
            return "Error listing directory: " + ex.getMessage();
        }
    }
}
