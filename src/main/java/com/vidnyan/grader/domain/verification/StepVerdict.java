package com.vidnyan.grader.domain.verification;

/**
 * Outcome of one validation step: pass, or fail with a single diagnostic line.
 */
public record StepVerdict(
    boolean passed,
    String message,
    MismatchCategory category
) {

    private static final StepVerdict PASS = new StepVerdict(true, "", null);

    public static StepVerdict pass() {
        return PASS;
    }

    public static StepVerdict fail(MismatchCategory category, String message) {
        return new StepVerdict(false, message, category);
    }

    public static StepVerdict of(boolean passed, String failureMessage) {
        return passed ? PASS : fail(MismatchCategory.NOT_FOUND, failureMessage);
    }
}
