package com.purchasingpower.prreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrReviewOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrReviewOrchestratorApplication.class, args);
    }
}
