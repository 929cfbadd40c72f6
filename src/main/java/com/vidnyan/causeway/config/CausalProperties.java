package com.vidnyan.causeway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for causal analysis.
 * Bound from {@code causeway.*} in application.properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "causeway")
public class CausalProperties {

    private Analyze analyze = new Analyze();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Fitting fitting = new Fitting();
    private Sampling sampling = new Sampling();
    private Service service = new Service();

    @Data
    public static class Analyze {
        /**
         * Source file or directory the command-line runner analyzes. Unset = runner is idle.
         */
        private String path;

        /**
         * static, dynamic or auto.
         */
        private String mode = "auto";
    }

    @Data
    public static class CircuitBreaker {
        private boolean enabled = true;

        /**
         * Consecutive failures before calls are short-circuited.
         */
        private int threshold = 3;
    }

    @Data
    public static class Fitting {
        /**
         * Model quality passed to the service: GOOD, BETTER or BEST.
         */
        private String quality = "GOOD";
        private double r2Threshold = 0.7;
        private double testSize = 0.2;
    }

    @Data
    public static class Sampling {
        private int numSamples = 100;
        private double inputMin = -10.0;
        private double inputMax = 10.0;

        /**
         * Fixed seed for reproducible runs. Unset = fresh randomness each run.
         */
        private Long seed;
    }

    @Data
    public static class Service {
        private List<String> fitCommand = new ArrayList<>(List.of("python3", "scripts/scm/fit_scm.py"));
        private List<String> queryCommand = new ArrayList<>(List.of("python3", "scripts/scm/query_fitted_scm.py"));
        private List<String> availabilityCommand =
                new ArrayList<>(List.of("python3", "-c", "import dowhy; print(dowhy.__version__)"));
        private Duration timeout = Duration.ofSeconds(60);
        private Duration availabilityTimeout = Duration.ofSeconds(5);
    }
}
