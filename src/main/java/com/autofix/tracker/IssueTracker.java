package com.autofix.tracker;

import com.autofix.core.error.StageError;
import com.autofix.core.model.Issue;
import com.autofix.core.model.IssueGroup;
import com.autofix.core.model.PublishRequest;
import com.autofix.core.result.Result;

import java.util.List;

/**
 * The issue tracker and code host the pipeline reports to.
 */
public interface IssueTracker {

    /**
     * Fetches issues and groups them. Upstream of the queue.
     */
    List<IssueGroup> fetchIssues(IssueCriteria criteria);

    Result<PublishRequest, StageError> createPublishRequest(List<Issue> issues, String branch, String baseBranch);

    Result<Void, StageError> markIssueFixed(int issueNumber, PublishRequest request);

    Result<Void, StageError> markIssueFailed(int issueNumber, String comment);

    Result<Void, StageError> markIssueInProgress(int issueNumber);
}
