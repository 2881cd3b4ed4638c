package com.autofix.core.guardrail;

import com.autofix.core.config.AutofixProperties;
import com.autofix.core.error.GuardrailErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.FileChange;
import com.autofix.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Validates a proposed change set before it is verified.
 * <p>
 * Forbidden patterns and files outside the allowed scopes reject the change set.
 * An overly broad change set is accepted with a warning attached to the analysis.
 */
@Service
public class GuardrailEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEvaluator.class);

    private final ForbiddenPatternDetector detector;
    private final ScopeAnalyzer scopeAnalyzer;
    private final List<String> allowedScopes;

    @Autowired
    public GuardrailEvaluator(AutofixProperties properties) {
        this(properties.getGuardrails().getForbiddenPatterns(),
                properties.getGuardrails().getAllowedScopes(),
                properties.getGuardrails().getMaxFilesPerFix(),
                properties.getGuardrails().getMaxDirectoriesPerFix());
    }

    public GuardrailEvaluator(List<String> forbiddenPatterns, List<String> allowedScopes,
                              int maxFiles, int maxDirectories) {
        this.detector = new ForbiddenPatternDetector(forbiddenPatterns);
        this.scopeAnalyzer = new ScopeAnalyzer(maxFiles, maxDirectories);
        this.allowedScopes = allowedScopes == null ? List.of() : List.copyOf(allowedScopes);
    }

    public Result<ScopeAnalysis, StageError> evaluate(List<FileChange> changes) {
        List<ForbiddenPatternMatch> matches = detector.detect(changes);
        if (!matches.isEmpty()) {
            log.warn("Rejected change set: {} forbidden pattern match(es)", matches.size());
            return Result.err(new StageError(GuardrailErrorCode.FORBIDDEN_PATTERN_DETECTED,
                    ForbiddenPatternDetector.format(matches), Map.of("matches", matches), null));
        }

        List<String> outside = scopeAnalyzer.filesOutsideScopes(changes, allowedScopes);
        if (!outside.isEmpty()) {
            log.warn("Rejected change set: {} file(s) outside allowed scopes {}", outside.size(), allowedScopes);
            return Result.err(new StageError(GuardrailErrorCode.SCOPE_TOO_BROAD,
                    "Files outside allowed scopes: " + String.join(", ", outside),
                    Map.of("outsideFiles", outside), null));
        }

        ScopeAnalysis analysis = scopeAnalyzer.analyze(changes);
        if (analysis.tooBroad()) {
            log.warn("Change set is broad: {}", analysis.warning());
        }
        return Result.ok(analysis);
    }
}
