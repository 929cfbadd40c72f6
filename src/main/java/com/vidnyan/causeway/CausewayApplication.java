package com.vidnyan.causeway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Causeway - causal graph extraction and intervention analysis for Java sources.
 */
@SpringBootApplication
public class CausewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausewayApplication.class, args);
    }
}
