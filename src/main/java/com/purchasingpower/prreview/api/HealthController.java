package com.purchasingpower.prreview.api;

import com.purchasingpower.prreview.configuration.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AppProperties appProperties;

    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("app_name", appProperties.getName());
        body.put("version", appProperties.getVersion());
        body.put("environment", appProperties.getEnvironment());
        return body;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Welcome to " + appProperties.getName());
        body.put("version", appProperties.getVersion());
        body.put("health", "/health");
        return body;
    }
}
