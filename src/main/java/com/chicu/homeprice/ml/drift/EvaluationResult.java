package com.chicu.homeprice.ml.drift;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Результат оценки дрейфа.
 * INSUFFICIENT_* не ошибки: это осознанное "решать пока не из чего".
 * decision заполнен только для HEALTHY / DEGRADED.
 */
@Builder
public record EvaluationResult(
        Status status,
        String reason,
        int windowDays,
        LocalDateTime cutoff,
        int totalEntries,
        int invalidTimestamps,
        int feedbackInWindow,
        int minFeedback,
        EvaluationDecision decision
) {

    public enum Status {
        INSUFFICIENT_DATA,
        INSUFFICIENT_FEEDBACK,
        HEALTHY,
        DEGRADED
    }

    public boolean isNoOp() {
        return status == Status.INSUFFICIENT_DATA || status == Status.INSUFFICIENT_FEEDBACK;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public static EvaluationResult insufficientData(String reason, int windowDays, int totalEntries) {
        return EvaluationResult.builder()
                .status(Status.INSUFFICIENT_DATA)
                .reason(reason)
                .windowDays(windowDays)
                .totalEntries(totalEntries)
                .build();
    }

    public static EvaluationResult insufficientFeedback(int windowDays,
                                                        LocalDateTime cutoff,
                                                        int totalEntries,
                                                        int invalidTimestamps,
                                                        int feedbackInWindow,
                                                        int minFeedback) {
        return EvaluationResult.builder()
                .status(Status.INSUFFICIENT_FEEDBACK)
                .reason("feedback in window " + feedbackInWindow + " < required " + minFeedback)
                .windowDays(windowDays)
                .cutoff(cutoff)
                .totalEntries(totalEntries)
                .invalidTimestamps(invalidTimestamps)
                .feedbackInWindow(feedbackInWindow)
                .minFeedback(minFeedback)
                .build();
    }

    public static EvaluationResult decided(EvaluationDecision d,
                                           LocalDateTime cutoff,
                                           int totalEntries,
                                           int invalidTimestamps,
                                           int minFeedback) {
        return EvaluationResult.builder()
                .status(d.degraded() ? Status.DEGRADED : Status.HEALTHY)
                .reason(d.degraded()
                        ? "rmse " + d.rmse() + " > limit " + d.limitRmse()
                        : "rmse " + d.rmse() + " <= limit " + d.limitRmse())
                .windowDays(d.windowDays())
                .cutoff(cutoff)
                .totalEntries(totalEntries)
                .invalidTimestamps(invalidTimestamps)
                .feedbackInWindow(d.nFeedback())
                .minFeedback(minFeedback)
                .decision(d)
                .build();
    }
}
