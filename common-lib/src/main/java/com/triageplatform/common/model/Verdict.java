package com.triageplatform.common.model;

/**
 * The validator's judgment on a single {@link WorkerResult}.
 *
 * <p>The original result is always retained so a rejection can be logged with its context.
 * {@code rejectionReason} is non-null iff {@code valid} is false.
 */
public record Verdict(boolean valid, WorkerResult result, String rejectionReason) {

    public static Verdict accepted(WorkerResult result) {
        return new Verdict(true, result, null);
    }

    public static Verdict rejected(WorkerResult result, String reason) {
        return new Verdict(false, result, reason);
    }
}
