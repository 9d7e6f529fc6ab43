package com.tapas.pando.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final String serviceName;

    public HealthController(@Value("${spring.application.name:doris-analytics-backend}") String serviceName) {
        this.serviceName = serviceName;
    }

    @Operation(summary = "Liveness probe", description = "Never touches the warehouse.")
    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", serviceName);
    }
}
