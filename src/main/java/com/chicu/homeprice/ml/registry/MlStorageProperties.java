package com.chicu.homeprice.ml.registry;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.storage")
public class MlStorageProperties {
    private String modelsDir = "./artifacts";
}
