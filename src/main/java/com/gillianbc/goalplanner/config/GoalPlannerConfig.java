package com.gillianbc.goalplanner.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gillianbc.goalplanner.store.JsonFilePortfolioStore;
import com.gillianbc.goalplanner.store.PortfolioStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.nio.file.Path;

/**
 * Wires the planner services and the JSON portfolio store.
 * Store location comes from {@code goal-planner.properties}; system properties override it.
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.gillianbc.goalplanner")
@PropertySource("classpath:goal-planner.properties")
public class GoalPlannerConfig {

    @Bean
    public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public PortfolioStore portfolioStore(ObjectMapper objectMapper,
                                         @Value("${planner.store.directory}") String directory,
                                         @Value("${planner.store.key}") String key) {
        log.info("Portfolio store: directory={} key={}", directory, key);
        return new JsonFilePortfolioStore(objectMapper, Path.of(directory), key);
    }
}
