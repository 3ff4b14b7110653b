package com.chicu.homeprice.ml.drift;

import lombok.Builder;

/**
 * Итог сравнения окна с baseline. Ничего не персистится, только возвращается и логируется.
 */
@Builder
public record EvaluationDecision(
        int windowDays,
        int nFeedback,
        double rmse,
        double mae,
        double r2,
        double baselineRmse,
        double threshold,
        boolean degraded
) {

    /**
     * Порог, выше которого RMSE считается деградацией.
     */
    public double limitRmse() {
        return baselineRmse * (1.0 + threshold);
    }
}
