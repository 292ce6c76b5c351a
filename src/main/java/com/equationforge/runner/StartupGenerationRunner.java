package com.equationforge.runner;

import com.equationforge.config.AppProperties;
import com.equationforge.generator.GameMode;
import com.equationforge.generator.GenerationOptions;
import com.equationforge.generator.GenerationResult;
import com.equationforge.generator.GenerationService;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class StartupGenerationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupGenerationRunner.class);

    private final GenerationService generationService;
    private final AppProperties properties;

    public StartupGenerationRunner(GenerationService generationService, AppProperties properties) {
        this.generationService = generationService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void generateOnStartup() {
        for (GameMode mode : properties.getStartupModes()) {
            generate(mode);
        }
    }

    void generate(GameMode mode) {
        GenerationOptions options = GenerationOptions.builder()
                .mode(mode)
                .parallelism(properties.getParallelism())
                .build();
        try {
            GenerationResult result = generationService.runGeneration(options);
            Path savedPath = generationService.persistEquations(result, properties.getOutputDirectory());
            log.info("Startup generation {}: {} saved at {}", mode.label(), result.summary(), savedPath);
        } catch (Exception ex) {
            log.error("Startup generation failed for {}", mode.label(), ex);
        }
    }
}
