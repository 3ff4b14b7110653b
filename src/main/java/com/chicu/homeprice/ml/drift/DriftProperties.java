package com.chicu.homeprice.ml.drift;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ml.drift")
public class DriftProperties {

    /**
     * Ширина скользящего окна, дней
     */
    private int windowDays = 7;

    /**
     * Минимум записей с real_price в окне, иначе решение не принимаем
     */
    private int minFeedback = 20;

    /**
     * Допустимое относительное ухудшение RMSE (0.10 = на 10% хуже baseline)
     */
    private double threshold = 0.10;

    /**
     * Периодическая оценка внутри приложения
     */
    private boolean scheduleEnabled = false;

    private Duration initialDelay = Duration.ofMinutes(30);

    private Duration interval = Duration.ofHours(6);

    /**
     * При деградации сразу переобучить и перезагрузить модель
     */
    private boolean autoRetrain = false;
}
