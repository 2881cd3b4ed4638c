package com.autofix.core.guardrail;

import com.autofix.core.model.FileChange;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public class ScopeAnalyzer {

    static final Set<String> COMPONENT_CONTAINERS = Set.of("components", "modules", "features", "packages");

    private final int maxFiles;
    private final int maxDirectories;

    public ScopeAnalyzer(int maxFiles, int maxDirectories) {
        this.maxFiles = maxFiles;
        this.maxDirectories = maxDirectories;
    }

    public ScopeAnalysis analyze(List<FileChange> changes) {
        var directories = new TreeSet<String>();
        var components = new TreeSet<String>();

        for (FileChange change : changes) {
            directories.add(parentOf(change.path()));
            String[] parts = change.path().split("[/\\\\]");
            for (int i = 0; i < parts.length - 1; i++) {
                if (COMPONENT_CONTAINERS.contains(parts[i]) && !parts[i + 1].isEmpty()) {
                    components.add(parts[i + 1]);
                }
            }
        }

        int totalFiles = changes.size();
        boolean tooBroad = totalFiles > maxFiles || directories.size() > maxDirectories;
        String warning = tooBroad ? warning(totalFiles, directories.size()) : null;
        return new ScopeAnalysis(totalFiles, List.copyOf(directories), List.copyOf(components), tooBroad, warning);
    }

    /**
     * Files that fall outside every allowed prefix. An empty allow-list permits everything.
     */
    public List<String> filesOutsideScopes(List<FileChange> changes, List<String> allowedScopes) {
        if (allowedScopes == null || allowedScopes.isEmpty()) {
            return List.of();
        }
        var outside = new ArrayList<String>();
        for (FileChange change : changes) {
            boolean allowed = allowedScopes.stream().anyMatch(scope -> change.path().startsWith(scope));
            if (!allowed) {
                outside.add(change.path());
            }
        }
        return outside;
    }

    private String warning(int totalFiles, int totalDirectories) {
        var parts = new ArrayList<String>();
        if (totalFiles > maxFiles) {
            parts.add("Too many files changed: " + totalFiles + " (max: " + maxFiles + ")");
        }
        if (totalDirectories > maxDirectories) {
            parts.add("Too many directories affected: " + totalDirectories + " (max: " + maxDirectories + ")");
        }
        return String.join(". ", parts);
    }

    private static String parentOf(String path) {
        String normalized = path.replace('\\', '/');
        int idx = normalized.lastIndexOf('/');
        return idx < 0 ? "." : normalized.substring(0, idx);
    }
}
