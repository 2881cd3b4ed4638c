package com.autofix.checks;

import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckType;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs verification checks in a directory.
 */
public interface CheckRunner {

    /**
     * Runs the checks in the given order. With {@code failFast}, checks after the first
     * non-passing one are reported as skipped.
     */
    CheckResult runChecks(Path path, List<CheckType> checks, boolean failFast);
}
