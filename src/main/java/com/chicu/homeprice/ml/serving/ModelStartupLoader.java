package com.chicu.homeprice.ml.serving;

import com.chicu.homeprice.ml.registry.RegistryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class ModelStartupLoader implements ApplicationRunner {

    private final ModelHandle modelHandle;
    private final ServingProperties props;

    @Override
    public void run(ApplicationArguments args) {
        // train / evaluate из CLI модель для обслуживания не нужна
        if (args.containsOption("command")) return;

        if (!props.isLoadOnStartup()) {
            log.info("ℹ️ ml.serving.load-on-startup=false, model is not loaded");
            return;
        }
        try {
            modelHandle.reload();
        } catch (RegistryException e) {
            // приложение не валим: /predict отвечает 503, /readyz = not ready
            log.warn("⚠️ Service is NOT ready: {}", e.getMessage());
        }
    }
}
