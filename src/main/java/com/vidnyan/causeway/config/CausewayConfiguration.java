package com.vidnyan.causeway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.causeway.application.port.out.ScmService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for Causeway components.
 */
@Slf4j
@Configuration
public class CausewayConfiguration {

    /**
     * ObjectMapper for the SCM service wire format and the REST API.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log the SCM service settings on startup.
     */
    @Bean
    public String logScmService(ScmService scmService, CausalProperties properties) {
        log.info("SCM service: {} (fit: {}, query: {}, timeout: {})",
                scmService.getClass().getSimpleName(),
                properties.getService().getFitCommand(),
                properties.getService().getQueryCommand(),
                properties.getService().getTimeout());
        log.info("Circuit breaker: enabled={}, threshold={}",
                properties.getCircuitBreaker().isEnabled(), properties.getCircuitBreaker().getThreshold());
        return "scm-service-logged";
    }
}
