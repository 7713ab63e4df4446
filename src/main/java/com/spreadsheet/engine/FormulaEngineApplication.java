package com.spreadsheet.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Boots the formula engine and the in-memory sheet orchestrator as Spring beans.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FormulaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaEngineApplication.class, args);
    }
}
