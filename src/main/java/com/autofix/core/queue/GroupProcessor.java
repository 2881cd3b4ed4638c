package com.autofix.core.queue;

import com.autofix.core.model.GroupResult;
import com.autofix.core.model.IssueGroup;

/**
 * Turns one attempt at a group into a result. A thrown exception counts as a failed attempt.
 */
@FunctionalInterface
public interface GroupProcessor {

    GroupResult process(IssueGroup group, int attempt) throws Exception;
}
