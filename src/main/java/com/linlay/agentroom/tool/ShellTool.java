package com.linlay.agentroom.tool;

import com.linlay.agentroom.config.ToolProperties;
import com.linlay.agentroom.security.InputValidationException;
import com.linlay.agentroom.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/* 命令白名单可以通过配置调整
```yaml
agent:
  tools:
    shell:
      allowed-commands: [ls, cat, git]
      timeout: 10s
```
*/

/**
 * Runs an allow-listed command (no shell interpreter) in the working directory. Path arguments must
 * stay inside the authorized directories.
 */
public class ShellTool extends AbstractWorkspaceTool {

    private static final Logger log = LoggerFactory.getLogger(ShellTool.class);

    private static final Set<String> COMMANDS_WITH_PATH_ARGS = Set.of("ls", "cat", "head", "tail", "wc", "find", "git");

    private final Set<String> allowedCommands;
    private final Duration timeout;
    private final int maxOutputChars;

    public ShellTool(PathValidator pathValidator, ToolProperties.Shell properties) {
        super(pathValidator);
        this.allowedCommands = Set.copyOf(properties.getAllowedCommands());
        this.timeout = properties.getTimeout() == null ? Duration.ofSeconds(10) : properties.getTimeout();
        this.maxOutputChars = properties.getMaxOutputChars() > 0 ? properties.getMaxOutputChars() : 4000;
    }

    @Override
    public String name() {
        return "shell";
    }

    @Override
    public String description() {
        return "Execute a shell command. Use for filesystem inspection or git. Allowed commands: "
                + String.join(", ", allowedCommands.stream().sorted().toList());
    }

    @Override
    public String primaryArgument() {
        return "command";
    }

    @Override
    public String invoke(Map<String, String> args) {
        String rawCommand = argument(args, "command");
        if (rawCommand.isEmpty()) {
            return "Error: Missing argument: command";
        }

        List<String> tokens = tokenize(rawCommand);
        String baseCommand = tokens.get(0);
        if (!allowedCommands.contains(baseCommand)) {
            return "Error: Command not allowed: " + baseCommand;
        }

        String argsError = unsafeArgumentError(tokens);
        if (argsError != null) {
            return "Error: " + argsError;
        }
        List<String> expanded = expandPathGlobs(tokens);
        String expandedArgsError = unsafeArgumentError(expanded);
        if (expandedArgsError != null) {
            return "Error: " + expandedArgsError;
        }

        Process process;
        try {
            process = new ProcessBuilder(expanded)
                    .directory(pathValidator.workingDirectory().toFile())
                    .start();
        } catch (IOException ex) {
            return "Error executing command: " + ex.getMessage();
        }
        log.debug("Running {}", expanded);

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return "Error: Command timed out after " + timeout.toSeconds() + "s";
            }
            return format(process.exitValue(), stdout.get().strip(), stderr.get().strip());
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return "Error executing command: interrupted";
        } catch (ExecutionException ex) {
            return "Error executing command: " + ex.getCause().getMessage();
        }
    }

    private String format(int exitCode, String stdout, String stderr) {
        StringBuilder text = new StringBuilder();
        if (exitCode != 0) {
            text.append("exitCode: ").append(exitCode).append('\n');
        }
        if (!stderr.isEmpty()) {
            text.append("Output:\n").append(truncate(stdout)).append("\nErrors:\n").append(truncate(stderr));
        } else if (!stdout.isEmpty()) {
            text.append(truncate(stdout));
        } else {
            text.append("Command executed successfully (no output).");
        }
        return text.toString();
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }

    private List<String> tokenize(String rawCommand) {
        List<String> tokens = new ArrayList<>();
        for (String token : rawCommand.trim().split("\\s+")) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private List<String> expandPathGlobs(List<String> tokens) {
        String baseCommand = tokens.get(0);
        if (!COMMANDS_WITH_PATH_ARGS.contains(baseCommand) || tokens.size() == 1) {
            return tokens;
        }
        List<String> expanded = new ArrayList<>();
        expanded.add(baseCommand);
        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.startsWith("-") || !containsGlob(token)) {
                expanded.add(token);
                continue;
            }
            List<String> matches = expandSingleGlobToken(token);
            if (matches.isEmpty()) {
                expanded.add(token);
            } else {
                expanded.addAll(matches);
            }
        }
        return expanded;
    }

    private List<String> expandSingleGlobToken(String token) {
        Path tokenPath = Path.of(token);
        Path parent = tokenPath.getParent();
        String pattern = tokenPath.getFileName() == null ? token : tokenPath.getFileName().toString();
        if (parent != null && containsGlob(parent.toString())) {
            return List.of();
        }

        Path workingDirectory = pathValidator.workingDirectory();
        Path searchDir = parent == null
                ? workingDirectory
                : parent.isAbsolute() ? parent.normalize() : workingDirectory.resolve(parent).normalize();
        if (!pathValidator.isAllowed(searchDir) || !Files.isDirectory(searchDir)) {
            return List.of();
        }

        List<String> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(searchDir, pattern)) {
            for (Path path : stream) {
                matches.add(pathValidator.relativize(path.normalize()));
            }
        } catch (IOException ex) {
            log.debug("Glob '{}' not expanded: {}", token, ex.getMessage());
            return List.of();
        }
        matches.sort(Comparator.naturalOrder());
        return matches;
    }

    private boolean containsGlob(String token) {
        return token.contains("*") || token.contains("?") || token.contains("[");
    }

    private String unsafeArgumentError(List<String> tokens) {
        String baseCommand = tokens.get(0);
        if (!COMMANDS_WITH_PATH_ARGS.contains(baseCommand) || tokens.size() == 1) {
            return null;
        }
        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.startsWith("-") || containsGlob(token)) {
                continue;
            }
            try {
                pathValidator.resolve(token);
            } catch (InputValidationException ex) {
                return "Path not allowed: " + token + " (" + ex.getMessage() + ")";
            }
        }
        return null;
    }

    private String truncate(String text) {
        if (text.length() <= maxOutputChars) {
            return text;
        }
        return text.substring(0, maxOutputChars) + "...(truncated)";
    }
}
