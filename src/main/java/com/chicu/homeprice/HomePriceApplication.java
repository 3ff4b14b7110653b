package com.chicu.homeprice;

import com.chicu.homeprice.cli.MlCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication(scanBasePackages = "com.chicu.homeprice")
public class HomePriceApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(HomePriceApplication.class);

        // --command=train|evaluate: без веб-сервера, код выхода отдаём наружу (CI / планировщик)
        if (MlCommandRunner.isCommandInvocation(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(app.run(args)));
        }

        app.run(args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
