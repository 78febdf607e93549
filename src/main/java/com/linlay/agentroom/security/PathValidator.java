package com.linlay.agentroom.security;

import com.linlay.agentroom.config.ToolProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves tool-supplied paths and rejects anything outside the working directory and the
 * configured roots, traversal segments, and well-known credential files.
 */
@Component
public class PathValidator {

    private static final Pattern BLOCKED = Pattern.compile(
            "/etc/passwd|/etc/shadow|\\.ssh/|\\.aws/|\\.env$|\\.key$|\\.pem$|id_rsa|credentials",
            Pattern.CASE_INSENSITIVE
    );

    private final Path workingDirectory;
    private final List<Path> allowedRoots;

    @Autowired
    public PathValidator(ToolProperties properties) {
        this(resolveWorkingDirectory(properties.getWorkingDirectory()), parseAllowedPaths(properties.getAllowedPaths()));
    }

    public PathValidator(Path workingDirectory, List<Path> additionalAllowedRoots) {
        this.workingDirectory = realPath(workingDirectory.toAbsolutePath().normalize());
        LinkedHashSet<Path> roots = new LinkedHashSet<>();
        roots.add(this.workingDirectory);
        if (additionalAllowedRoots != null) {
            for (Path root : additionalAllowedRoots) {
                if (root != null) {
                    roots.add(realPath(root.toAbsolutePath().normalize()));
                }
            }
        }
        this.allowedRoots = List.copyOf(roots);
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * @return the absolute, normalized path (symlinks resolved where the file exists)
     * @throws InputValidationException when the path is rejected
     */
    public Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new InputValidationException("File path cannot be empty");
        }
        if (rawPath.indexOf('\0') >= 0) {
            throw new InputValidationException("File path cannot contain null bytes");
        }
        String expanded = expandHome(rawPath.trim());
        Path candidate;
        try {
            candidate = Path.of(expanded);
        } catch (InvalidPathException ex) {
            throw new InputValidationException("Invalid file path: " + ex.getMessage());
        }
        for (Path part : candidate) {
            if ("..".equals(part.toString())) {
                throw new InputValidationException("Path traversal detected: '..' not allowed");
            }
        }

        Path absolute = candidate.isAbsolute() ? candidate : workingDirectory.resolve(candidate);
        Path resolved = realPath(absolute.normalize());
        if (BLOCKED.matcher(resolved.toString().replace('\\', '/')).find()) {
            throw new InputValidationException("Access to sensitive file blocked: " + rawPath);
        }
        if (!isAllowed(resolved)) {
            throw new InputValidationException("Path '" + rawPath + "' is not within allowed directories");
        }
        return resolved;
    }

    public boolean isAllowed(Path path) {
        for (Path root : allowedRoots) {
            if (path.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    public String relativize(Path path) {
        if (path.startsWith(workingDirectory)) {
            String relative = workingDirectory.relativize(path).toString();
            return relative.isEmpty() ? "." : relative;
        }
        return path.toString();
    }

    private static Path realPath(Path path) {
        if (!Files.exists(path)) {
            return path;
        }
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path;
        }
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home", "") + path.substring(1);
        }
        return path;
    }

    private static Path resolveWorkingDirectory(String configuredWorkingDirectory) {
        if (configuredWorkingDirectory == null || configuredWorkingDirectory.isBlank()) {
            return Path.of(System.getProperty("user.dir", ".")).toAbsolutePath().normalize();
        }
        return Path.of(configuredWorkingDirectory).toAbsolutePath().normalize();
    }

    private static List<Path> parseAllowedPaths(List<String> configuredAllowedPaths) {
        List<Path> paths = new ArrayList<>();
        if (configuredAllowedPaths == null) {
            return paths;
        }
        for (String configured : configuredAllowedPaths) {
            if (configured != null && !configured.isBlank()) {
                paths.add(Path.of(expandHome(configured.trim())).toAbsolutePath().normalize());
            }
        }
        return paths;
    }
}
