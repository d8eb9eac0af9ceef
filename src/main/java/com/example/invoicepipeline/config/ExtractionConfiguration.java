package com.example.invoicepipeline.config;

import com.example.invoicepipeline.application.extraction.ExtractionPatterns;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the shared extraction rule set and the clock used for processing timestamps.
 */
@Configuration
@EnableConfigurationProperties(InvoicePipelineProperties.class)
public class ExtractionConfiguration {

    @Bean
    public ExtractionPatterns extractionPatterns() {
        return ExtractionPatterns.defaults();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
