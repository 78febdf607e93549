package com.linlay.agentroom.tool;

import com.linlay.agentroom.security.InputValidationException;
import com.linlay.agentroom.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive substring search over the text files of the working directory.
 */
public class SearchTool extends AbstractWorkspaceTool {

    private static final Logger log = LoggerFactory.getLogger(SearchTool.class);

    static final int MAX_RESULTS = 20;
    private static final Set<String> IGNORED_DIRS = Set.of(
            ".git", "__pycache__", ".venv", ".pytest_cache", "node_modules", ".context", "target", ".idea");
    private static final Set<String> IGNORED_EXTENSIONS = Set.of(
            ".pyc", ".pyo", ".pyd", ".so", ".dll", ".exe", ".bin", ".lock", ".class", ".jar");

    public SearchTool(PathValidator pathValidator) {
        super(pathValidator);
    }

    @Override
    public String name() {
        return "search";
    }

    @Override
    public String description() {
        return "Search for a keyword in the workspace. Argument is the query string.";
    }

    @Override
    public String primaryArgument() {
        return "query";
    }

    @Override
    public String invoke(Map<String, String> args) {
        String query = argument(args, "query");
        if (query.isEmpty()) {
            return "Error: Missing argument: query";
        }
        String needle = query.toLowerCase(Locale.ROOT);
        Path root = pathValidator.workingDirectory();
        List<String> results = new ArrayList<>();
        boolean[] truncated = {false};
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && IGNORED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || isIgnored(file) || !isReadable(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    List<String> lines = readLines(file);
                    for (int i = 0; i < lines.size(); i++) {
                        if (!lines.get(i).toLowerCase(Locale.ROOT).contains(needle)) {
                            continue;
                        }
                        if (results.size() >= MAX_RESULTS) {
                            truncated[0] = true;
                            return FileVisitResult.TERMINATE;
                        }
                        results.add(root.relativize(file) + ":" + (i + 1) + ": " + lines.get(i).strip());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            return "Error during search: " + ex.getMessage();
        }

        if (results.isEmpty()) {
            return "No results found for '" + query + "'.";
        }
        String joined = String.join("\n", results);
        return truncated[0] ? joined + "\n... (more results found, please refine your search)" : joined;
    }

    private boolean isIgnored(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && IGNORED_EXTENSIONS.contains(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    private boolean isReadable(Path file) {
        try {
            pathValidator.resolve(file.toString());
            return true;
        } catch (InputValidationException ex) {
            return false;
        }
    }

    private List<String> readLines(Path file) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            String content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return content.lines().toList();
        } catch (IOException ex) {
            log.debug("Skipping {}: {}", file, ex.getMessage());
            return List.of();
        }
    }
}
