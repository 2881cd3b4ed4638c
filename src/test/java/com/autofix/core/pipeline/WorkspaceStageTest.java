package com.autofix.core.pipeline;

import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.Workspace;
import com.autofix.core.model.WorkspaceStatus;
import com.autofix.core.result.Result;
import com.autofix.vcs.VersionControl;
import com.autofix.vcs.WorktreeRegistry;
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
class WorkspaceStageTest {

    @Mock private WorktreeRegistry registry;
    @Mock private VersionControl versionControl;

    private WorkspaceStage stage;
    private PipelineContext context;
    private Workspace workspace;

    @BeforeEach
    void setUp() {
        stage = new WorkspaceStage(registry, versionControl, "main");
        context = new PipelineContext(IssueGroup.of("issue-9", "g", "fix/issue-9", List.of()), 1);
        workspace = new Workspace(Path.of("/tmp/wt/fix-issue-9"), "fix/issue-9", "main", WorkspaceStatus.READY,
                List.of(9), Instant.now(), Instant.now());
        context.setWorkspace(workspace);
    }

    @Test
    void cleanupReleasesOnlyOnce() {
        when(registry.release(workspace, false)).thenReturn(Result.ok(null));

        stage.cleanup(context, false);
        stage.cleanup(context, true);

        verify(registry, times(1)).release(any(), anyBoolean());
        assertTrue(context.workspace().isEmpty());
    }

    @Test
    void cleanupWithoutWorkspaceIsANoOp() {
        context.takeWorkspace();

        stage.cleanup(context, true);

        verifyNoInteractions(registry);
    }
}
