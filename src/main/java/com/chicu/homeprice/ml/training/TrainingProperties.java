package com.chicu.homeprice.ml.training;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.training")
public class TrainingProperties {

    /**
     * CSV с датасетом по умолчанию
     */
    private String dataPath = "data/HousingData.csv";

    /**
     * Тег запуска по умолчанию (часть run id)
     */
    private String defaultTag = "rf";

    /**
     * Число фолдов CV
     */
    private int folds = 5;

    /**
     * Seed перемешивания фолдов (воспроизводимость baseline)
     */
    private long seed = 42L;

    /**
     * Сила L2-регуляризации
     */
    private double ridgeAlpha = 1.0;
}
