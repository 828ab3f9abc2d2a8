package com.codeauditor.core.audit;

import com.codeauditor.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Finds the projects of a workspace: its immediate subdirectories minus a denylist.
 */
public final class ProjectDiscovery {

    private ProjectDiscovery() {
    }

    /**
     * Lists project directories under a workspace root.
     *
     * @param workspace workspace directory
     * @param excluded directory names never treated as projects
     * @return project directories, sorted case-insensitively by name
     * @throws IOException if the workspace cannot be listed
     */
    public static List<Path> discover(Path workspace, Set<String> excluded) throws IOException {
        return FileUtils.listSubdirectories(workspace).stream()
            .filter(dir -> !excluded.contains(dir.getFileName().toString()))
            .toList();
    }
}
