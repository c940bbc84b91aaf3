package com.delta.autoapply.config;

import com.delta.autoapply.apply.pacing.PacingGovernor;
import com.delta.autoapply.apply.pacing.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AutoApplyConfig {

    @Bean(name = "applicationExecutor", destroyMethod = "shutdown")
    public ExecutorService applicationExecutor(AutoApplyProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getApplicationThreads());
    }

    @Bean(name = "progressExecutor", destroyMethod = "shutdown")
    public ExecutorService progressExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public PacingGovernor pacingGovernor(AutoApplyProperties properties) {
        return new PacingGovernor(properties.getPacing(), Sleeper.system(), new SecureRandom());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
