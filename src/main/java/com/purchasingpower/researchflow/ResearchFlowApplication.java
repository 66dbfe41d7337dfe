package com.purchasingpower.researchflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ResearchFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchFlowApplication.class, args);
    }
}
