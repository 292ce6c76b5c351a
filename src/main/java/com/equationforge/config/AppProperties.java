package com.equationforge.config;

import com.equationforge.generator.GameMode;
import com.equationforge.generator.GenerationOptions;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    private static final String DEFAULT_OUTPUT_DIR = "equations";

    private final Path outputDirectory;
    private final int parallelism;
    private final List<GameMode> startupModes;

    public AppProperties(Environment environment) {
        String outputDir = resolveOptional(environment, "app.output-dir", "EQUATIONS_OUTPUT_DIR");
        this.outputDirectory = Path.of(outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR);
        this.parallelism = determineParallelism(environment);
        this.startupModes = determineStartupModes(environment);
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public int getParallelism() {
        return parallelism;
    }

    public List<GameMode> getStartupModes() {
        return startupModes;
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int determineParallelism(Environment environment) {
        String raw = resolveOptional(environment, "app.parallelism", "GENERATOR_PARALLELISM");
        if (!StringUtils.hasText(raw)) {
            return GenerationOptions.defaultParallelism();
        }
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException();
            }
            return value;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid parallelism value: " + raw, ex);
        }
    }

    private List<GameMode> determineStartupModes(Environment environment) {
        String raw = resolveOptional(environment, "app.generate-on-startup", "GENERATE_ON_STARTUP");
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        List<GameMode> modes = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!StringUtils.hasText(part)) {
                continue;
            }
            try {
                GameMode mode = GameMode.parse(part);
                if (!modes.contains(mode)) {
                    modes.add(mode);
                }
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("GENERATE_ON_STARTUP contains an unknown mode: " + part.trim(), ex);
            }
        }
        return List.copyOf(modes);
    }
}
