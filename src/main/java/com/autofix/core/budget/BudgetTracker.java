package com.autofix.core.budget;

import com.autofix.core.error.AiErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.model.IssueGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * USD spend of the code-generation tool, per group attempt and for the whole run.
 * <p>
 * A null limit means unlimited. Spend is keyed by group instance, so two groups that
 * share an id are still charged separately. Once either limit is reached every further
 * tool call for that group (or, for the session limit, any group) is refused with
 * {@link AiErrorCode#BUDGET_EXCEEDED}.
 * <p>
 * When the higher of the two utilizations reaches {@value #FALLBACK_THRESHOLD} the
 * fallback model is used instead of the preferred one.
 */
public class BudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(BudgetTracker.class);

    static final double FALLBACK_THRESHOLD = 0.8;

    private final BigDecimal maxPerGroup;
    private final BigDecimal maxPerSession;
    private final String preferredModel;
    private final String fallbackModel;

    private final Map<IssueGroup, BigDecimal> groupSpend = new IdentityHashMap<>();
    private BigDecimal sessionSpend = BigDecimal.ZERO;

    public BudgetTracker(BigDecimal maxPerGroup, BigDecimal maxPerSession, String preferredModel,
                         String fallbackModel) {
        this.maxPerGroup = maxPerGroup;
        this.maxPerSession = maxPerSession;
        this.preferredModel = preferredModel;
        this.fallbackModel = fallbackModel;
    }

    public static BudgetTracker unlimited() {
        return new BudgetTracker(null, null, null, null);
    }

    /**
     * Error to fail the group with if no budget is left for it.
     */
    public synchronized Optional<StageError> checkAvailable(IssueGroup group) {
        if (maxPerSession != null && sessionSpend.compareTo(maxPerSession) >= 0) {
            return Optional.of(StageError.of(AiErrorCode.BUDGET_EXCEEDED,
                    "Session budget of $" + maxPerSession.toPlainString() + " exhausted ($"
                            + sessionSpend.toPlainString() + " spent)"));
        }
        BigDecimal spent = spentOn(group);
        if (maxPerGroup != null && spent.compareTo(maxPerGroup) >= 0) {
            return Optional.of(StageError.of(AiErrorCode.BUDGET_EXCEEDED,
                    "Budget of $" + maxPerGroup.toPlainString() + " for group " + group.id() + " exhausted ($"
                            + spent.toPlainString() + " spent)"));
        }
        return Optional.empty();
    }

    /**
     * The most the next tool call may spend, or empty when neither limit is set.
     */
    public synchronized Optional<BigDecimal> remaining(IssueGroup group) {
        BigDecimal left = null;
        if (maxPerGroup != null) {
            left = maxPerGroup.subtract(spentOn(group)).max(BigDecimal.ZERO);
        }
        if (maxPerSession != null) {
            BigDecimal session = maxPerSession.subtract(sessionSpend).max(BigDecimal.ZERO);
            left = left == null ? session : left.min(session);
        }
        return Optional.ofNullable(left);
    }

    public synchronized void record(IssueGroup group, BigDecimal cost) {
        if (cost == null || cost.signum() <= 0) {
            return;
        }
        groupSpend.merge(group, cost, BigDecimal::add);
        sessionSpend = sessionSpend.add(cost);
        log.debug("Group {} spent ${} (group ${}, session ${})", group.id(), cost.toPlainString(),
                spentOn(group).toPlainString(), sessionSpend.toPlainString());
    }

    /**
     * Model to request for the group's next call, or empty to use the tool's default.
     */
    public synchronized Optional<String> model(IssueGroup group) {
        if (preferredModel == null) {
            return Optional.empty();
        }
        double utilization = Math.max(utilization(spentOn(group), maxPerGroup),
                utilization(sessionSpend, maxPerSession));
        if (utilization >= FALLBACK_THRESHOLD && fallbackModel != null) {
            return Optional.of(fallbackModel);
        }
        return Optional.of(preferredModel);
    }

    /**
     * Forgets the group's spend once its attempt is over. The session total is kept.
     */
    public synchronized void release(IssueGroup group) {
        groupSpend.remove(group);
    }

    public synchronized BigDecimal spentOn(IssueGroup group) {
        return groupSpend.getOrDefault(group, BigDecimal.ZERO);
    }

    public synchronized BigDecimal sessionSpend() {
        return sessionSpend;
    }

    private static double utilization(BigDecimal spent, BigDecimal limit) {
        if (limit == null || limit.signum() <= 0) {
            return 0;
        }
        return spent.divide(limit, 4, RoundingMode.HALF_UP).doubleValue();
    }
}
