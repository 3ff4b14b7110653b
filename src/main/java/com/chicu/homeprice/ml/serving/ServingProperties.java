package com.chicu.homeprice.ml.serving;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.serving")
public class ServingProperties {

    /**
     * Загружать активную модель при старте приложения
     */
    private boolean loadOnStartup = true;

    /**
     * Знаков после запятой в predicted_price
     */
    private int priceScale = 2;
}
