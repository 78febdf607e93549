package com.linlay.agentroom.tool;

import com.linlay.agentroom.security.InputValidationException;
import com.linlay.agentroom.security.PathValidator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ReadFileTool extends AbstractWorkspaceTool {

    public ReadFileTool(PathValidator pathValidator) {
        super(pathValidator);
    }

    @Override
    public String name() {
        return "read_file";
    }

    @Override
    public String description() {
        return "Read the contents of a file. Provide the path as the tool argument.";
    }

    @Override
    public String primaryArgument() {
        return "path";
    }

    @Override
    public String invoke(Map<String, String> args) {
        String rawPath = argument(args, "path");
        if (rawPath.isEmpty()) {
            return "Error: Missing argument: path";
        }
        try {
            Path path = pathValidator.resolve(rawPath);
            if (!Files.exists(path)) {
                return "Error: File '" + rawPath + "' does not exist.";
            }
            if (!Files.isRegularFile(path)) {
                return "Error: '" + rawPath + "' is a directory, not a file.";
            }
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (InputValidationException | IOException ex) {
            return "Error reading file: " + ex.getMessage();
        }
    }
}
