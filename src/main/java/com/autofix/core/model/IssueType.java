package com.autofix.core.model;

/**
 * Kind of tracked work item. Each kind maps onto a conventional-commit type.
 */
public enum IssueType {
    BUG("fix"),
    FEATURE("feat"),
    REFACTOR("refactor"),
    DOCS("docs"),
    TEST("test"),
    CHORE("chore");

    private final String commitType;

    IssueType(String commitType) {
        this.commitType = commitType;
    }

    public String commitType() {
        return commitType;
    }

    /**
     * Lenient lookup used when reading tracker labels; unknown values fall back to {@link #BUG}.
     */
    public static IssueType fromLabel(String label) {
        if (label == null) {
            return BUG;
        }
        for (IssueType type : values()) {
            if (type.name().equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return switch (label.trim().toLowerCase()) {
            case "enhancement" -> FEATURE;
            case "documentation" -> DOCS;
            default -> BUG;
        };
    }
}
