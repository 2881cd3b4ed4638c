package com.autofix.core.pipeline;

import com.autofix.ai.AiAdapter;
import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.AnalysisResult;
import com.autofix.core.model.ChangeType;
import com.autofix.core.model.Complexity;
import com.autofix.core.model.FileChange;
import com.autofix.core.model.FixResult;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.Workspace;
import com.autofix.core.model.WorkspaceStatus;
import com.autofix.core.result.Result;
import com.autofix.vcs.VersionControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FixStageTest {

    private static final Path WORKTREE = Path.of("/tmp/wt/fix-g");

    @Mock private AiAdapter aiAdapter;
    @Mock private VersionControl versionControl;

    private FixStage stage;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        stage = new FixStage(aiAdapter, versionControl);
        context = new PipelineContext(IssueGroup.of("g", "g", "fix/g", List.of()), 1);
        context.setWorkspace(new Workspace(WORKTREE, "fix/g", "main", WorkspaceStatus.READY, List.of(),
                Instant.now(), Instant.now()));
        context.setAnalysis(new AnalysisResult(List.of(), List.of(), "cause", "fix", 0.5, Complexity.LOW));
        context.setFeedback("Attempt 1 failed.");
    }

    @Test
    void reportedSuccessWithoutChangesOnDiskFails() {
        when(aiAdapter.applyFix(any(), any(), eq(WORKTREE), eq("Attempt 1 failed.")))
                .thenReturn(Result.ok(new FixResult(List.of(), "done", true, "")));
        when(versionControl.hasUncommittedChanges(WORKTREE)).thenReturn(false);

        Result<FixResult, StageError> result = stage.execute(context);

        assertEquals(AiErrorCode.FIX_FAILED, result.error().code());
        assertEquals(FixStage.NO_CHANGES_MESSAGE, result.error().message());
    }

    @Test
    void verifyChangesIsFalseWithoutWorkspace() {
        PipelineContext bare = new PipelineContext(IssueGroup.of("g", "g", "fix/g", List.of()), 1);

        assertFalse(stage.verifyChanges(bare));
        verifyNoInteractions(versionControl);
    }

    @Test
    void changesAreReadBackFromTheWorktree() {
        FileChange onDisk = new FileChange("src/a.ts", "fixed", ChangeType.MODIFIED);
        when(aiAdapter.applyFix(any(), any(), eq(WORKTREE), any()))
                .thenReturn(Result.ok(new FixResult(List.of(), "done", true, "fix: a")));
        when(versionControl.hasUncommittedChanges(WORKTREE)).thenReturn(true);
        when(versionControl.listChanges(WORKTREE)).thenReturn(List.of(onDisk));

        Result<FixResult, StageError> result = stage.execute(context);

        assertEquals(List.of(onDisk), result.value().changes());
        assertEquals("fix: a", result.value().commitMessage());
    }

    @Test
    void toolFailureIsAnError() {
        when(aiAdapter.applyFix(any(), any(), any(), any()))
                .thenReturn(Result.ok(new FixResult(List.of(), "gave up", false, "")));

        Result<FixResult, StageError> result = stage.execute(context);

        assertTrue(result.error().message().contains("gave up"));
        verify(versionControl, never()).listChanges(any());
    }
}
