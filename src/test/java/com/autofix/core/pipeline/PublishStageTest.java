package com.autofix.core.pipeline;

import com.autofix.core.error.OrchestratorErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.IssuePriority;
import com.autofix.core.model.IssueType;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.model.Workspace;
import com.autofix.core.model.WorkspaceStatus;
import com.autofix.core.result.Result;
import com.autofix.tracker.IssueTracker;
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
class PublishStageTest {

    @Mock private IssueTracker tracker;

    private PipelineContext context;

    @BeforeEach
    void setUp() {
        List<Issue> issues = List.of(
                new Issue(1, "a", "", IssueType.BUG, IssuePriority.LOW, List.of(), "", List.of(), ""),
                new Issue(2, "b", "", IssueType.BUG, IssuePriority.LOW, List.of(), "", List.of(), ""));
        context = new PipelineContext(IssueGroup.of("g", "g", "fix/g", issues), 1);
        context.setWorkspace(new Workspace(Path.of("/tmp/wt"), "fix/g", "main", WorkspaceStatus.READY, List.of(1, 2),
                Instant.now(), Instant.now()));
    }

    @Test
    void opensRequestAndMarksEveryIssueFixedEvenIfOneUpdateFails() {
        PublishRequest request = new PublishRequest(9, "https://example.test/pull/9", "fix", "fix/g", "develop");
        when(tracker.createPublishRequest(anyList(), eq("fix/g"), eq("develop"))).thenReturn(Result.ok(request));
        when(tracker.markIssueFixed(1, request))
                .thenReturn(Result.err(StageError.of(OrchestratorErrorCode.UNKNOWN, "label missing")));
        when(tracker.markIssueFixed(2, request)).thenReturn(Result.ok(null));

        Result<PublishRequest, StageError> result = new PublishStage(tracker, "develop").execute(context);

        assertEquals(request, result.value());
        verify(tracker).markIssueFixed(2, request);
    }

    @Test
    void trackerErrorsBecomePrCreationFailed() {
        when(tracker.createPublishRequest(anyList(), anyString(), anyString()))
                .thenReturn(Result.err(StageError.of(OrchestratorErrorCode.UNKNOWN, "gh: not authenticated")));

        Result<PublishRequest, StageError> result = new PublishStage(tracker, "main").execute(context);

        assertEquals(OrchestratorErrorCode.PR_CREATION_FAILED, result.error().code());
        assertEquals("gh: not authenticated", result.error().message());
        verify(tracker, never()).markIssueFixed(anyInt(), any());
    }
}
