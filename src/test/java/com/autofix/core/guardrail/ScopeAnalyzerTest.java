package com.autofix.core.guardrail;

import com.autofix.core.model.ChangeType;
import com.autofix.core.model.FileChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeAnalyzerTest {

    private final ScopeAnalyzer analyzer = new ScopeAnalyzer(20, 5);

    private static FileChange change(String path) {
        return new FileChange(path, "x", ChangeType.MODIFIED);
    }

    @Test
    @DisplayName("25 files across 6 directories is too broad and the warning names both counts")
    void tooBroad() {
        var changes = new ArrayList<FileChange>();
        for (int i = 0; i < 25; i++) {
            changes.add(change("dir" + (i % 6) + "/file" + i + ".ts"));
        }

        ScopeAnalysis analysis = analyzer.analyze(changes);

        assertTrue(analysis.tooBroad());
        assertEquals(25, analysis.totalFiles());
        assertEquals(6, analysis.directories().size());
        assertTrue(analysis.warning().contains("25"));
        assertTrue(analysis.warning().contains("6"));
    }

    @Test
    @DisplayName("limits are inclusive")
    void atLimitIsFine() {
        var changes = new ArrayList<FileChange>();
        for (int i = 0; i < 20; i++) {
            changes.add(change("dir" + (i % 5) + "/f" + i));
        }

        ScopeAnalysis analysis = analyzer.analyze(changes);

        assertFalse(analysis.tooBroad());
        assertNull(analysis.warning());
    }

    @Test
    @DisplayName("root files count as the '.' directory")
    void rootDirectory() {
        ScopeAnalysis analysis = analyzer.analyze(List.of(change("README.md"), change("src/a.ts")));

        assertEquals(List.of(".", "src"), analysis.directories());
    }

    @Test
    @DisplayName("components are taken from container directories")
    void extractsComponents() {
        ScopeAnalysis analysis = analyzer.analyze(List.of(
                change("src/components/Button/index.tsx"),
                change("packages/core/lib/a.js"),
                change("src/features/auth/login.ts"),
                change("src/util/strings.ts")));

        assertEquals(List.of("Button", "auth", "core"), analysis.components());
    }

    @Test
    @DisplayName("files outside allowed scopes are listed; an empty allow-list permits all")
    void allowedScopes() {
        List<FileChange> changes = List.of(change("src/a.ts"), change("docs/b.md"), change("test/c.ts"));

        assertEquals(List.of("docs/b.md"), analyzer.filesOutsideScopes(changes, List.of("src/", "test/")));
        assertTrue(analyzer.filesOutsideScopes(changes, List.of()).isEmpty());
    }
}
