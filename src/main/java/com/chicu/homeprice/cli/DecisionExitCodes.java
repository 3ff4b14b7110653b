package com.chicu.homeprice.cli;

import com.chicu.homeprice.ml.drift.EvaluationResult;

/**
 * Коды выхода для внешней автоматизации (CI / cron):
 * 0 = ничего делать не надо, 2 = рекомендуется переобучение, 1 = сама команда упала.
 */
public final class DecisionExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int DEGRADED = 2;

    private DecisionExitCodes() {
    }

    public static int of(EvaluationResult result) {
        if (result == null) throw new IllegalArgumentException("result=null");
        return switch (result.status()) {
            case DEGRADED -> DEGRADED;
            case HEALTHY, INSUFFICIENT_DATA, INSUFFICIENT_FEEDBACK -> OK;
        };
    }
}
