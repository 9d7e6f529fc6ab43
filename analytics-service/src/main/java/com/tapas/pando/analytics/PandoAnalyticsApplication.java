package com.tapas.pando.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@ConfigurationPropertiesScan
@SpringBootApplication
public class PandoAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PandoAnalyticsApplication.class, args);
    }
}
