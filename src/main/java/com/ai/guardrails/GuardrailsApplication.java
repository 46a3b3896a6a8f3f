package com.ai.guardrails;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GuardrailsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardrailsApplication.class, args);
    }
}
