package com.codeauditor.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for path handling shared by the runner, converters and discovery.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists the immediate subdirectories of a directory, sorted case-insensitively by name.
     *
     * @param directory directory to list
     * @return subdirectories
     * @throws IOException if the directory cannot be read
     */
    public static List<Path> listSubdirectories(Path directory) throws IOException {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                .filter(Files::isDirectory)
                .sorted(Comparator.comparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)))
                .toList();
        }
    }

    /**
     * Returns the directory an analyzer should run in for a target.
     *
     * <p>Directories are used as-is; for a file target its parent directory is used.
     *
     * @param target file or directory under analysis
     * @return absolute working directory
     */
    public static Path workingDirectoryFor(Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        if (Files.isDirectory(absolute) || absolute.getParent() == null) {
            return absolute;
        }
        return absolute.getParent();
    }

    /**
     * Returns the label used as the project root of findings: the directory's final name.
     *
     * @param workingDirectory analyzer working directory
     * @return root label, or the full path for filesystem roots
     */
    public static String rootLabel(String workingDirectory) {
        if (workingDirectory == null || workingDirectory.isBlank()) {
            return "";
        }
        Path path = Paths.get(workingDirectory).normalize();
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    /**
     * Converts a tool-reported path into a project-relative path with forward slashes.
     *
     * <p>Absolute paths under the working directory are relativized; relative paths are
     * normalized and stripped of a leading {@code ./}. Absolute paths outside the
     * working directory and unparseable values are returned unchanged.
     *
     * @param reported path as reported by the tool
     * @param workingDirectory analyzer working directory
     * @return project-relative path, or {@code null} if {@code reported} is {@code null}
     */
    public static String relativize(String reported, String workingDirectory) {
        if (reported == null) {
            return null;
        }
        if (reported.isBlank()) {
            return reported;
        }
        try {
            Path target = Paths.get(reported).normalize();
            if (target.isAbsolute() && workingDirectory != null && !workingDirectory.isBlank()) {
                Path base = Paths.get(workingDirectory).toAbsolutePath().normalize();
                if (target.startsWith(base)) {
                    target = base.relativize(target);
                }
            }
            String result = toForwardSlashes(target.toString());
            return result.isEmpty() ? "." : result;
        } catch (InvalidPathException e) {
            return reported;
        }
    }

    private static String toForwardSlashes(String path) {
        String result = path.replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }
}
