package com.markrunner.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.manifest.InputCollection;
import com.markrunner.core.manifest.ManifestBuilder;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.manifest.UnitPlanner;
import com.markrunner.core.stage.PlaceholderArtifactWriter;
import com.markrunner.core.stage.StageStateProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the plain (Spring-free) manifest and stage collaborators.
 */
@Configuration
public class MarkrunnerConfig {

    @Bean
    public InputCollection inputCollection(ObjectMapper objectMapper) {
        return new InputCollection(objectMapper);
    }

    @Bean
    public UnitPlanner unitPlanner() {
        return new UnitPlanner();
    }

    @Bean
    public ManifestBuilder manifestBuilder() {
        return new ManifestBuilder();
    }

    @Bean
    public ManifestFile manifestFile(ObjectMapper objectMapper) {
        return new ManifestFile(objectMapper);
    }

    @Bean
    public StageStateProbe stageStateProbe() {
        return new StageStateProbe();
    }

    @Bean
    public PlaceholderArtifactWriter placeholderArtifactWriter(ObjectMapper objectMapper) {
        return new PlaceholderArtifactWriter(objectMapper);
    }

    @Bean
    public FailureReportWriter failureReportWriter(ObjectMapper objectMapper) {
        return new FailureReportWriter(objectMapper);
    }
}
