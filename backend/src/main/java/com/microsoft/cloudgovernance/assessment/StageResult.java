package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.FailureReason;

/**
 * Outcome of one pipeline stage: a value, or the reason the run must fail.
 */
public final class StageResult<T> {

    private final T value;
    private final FailureReason failureReason;
    private final String detail;

    private StageResult(T value, FailureReason failureReason, String detail) {
        this.value = value;
        this.failureReason = failureReason;
        this.detail = detail;
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(value, null, null);
    }

    public static <T> StageResult<T> failure(FailureReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new StageResult<>(null, reason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Stage failed with " + failureReason);
        }
        return value;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Re-type a failure for the next stage.
     */
    public <R> StageResult<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Only failures can be propagated");
        }
        return new StageResult<>(null, failureReason, detail);
    }
}
