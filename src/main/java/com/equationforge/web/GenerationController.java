package com.equationforge.web;

import com.equationforge.config.AppProperties;
import com.equationforge.generator.EquationPattern;
import com.equationforge.generator.GameMode;
import com.equationforge.generator.GenerationOptions;
import com.equationforge.generator.GenerationResult;
import com.equationforge.generator.GenerationService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping
public class GenerationController {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);
    private static final int SAMPLE_SIZE = 20;
    private static final String CSV_MEDIA_TYPE = "text/csv";

    private final GenerationService generationService;
    private final AppProperties properties;

    public GenerationController(GenerationService generationService, AppProperties properties) {
        this.generationService = generationService;
        this.properties = properties;
    }

    @PostMapping(path = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public GenerateResponse generate(@RequestBody(required = false) GenerateRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        GameMode mode = parseMode(request.mode());

        GenerationOptions options;
        try {
            options = buildOptions(request, mode);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }

        GenerationResult result;
        try {
            result = generationService.runGeneration(options);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Generation failed: " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Generation failed: " + ex.getMessage(), ex);
        }

        // Bounded runs must not replace a complete table.
        Path savedPath = null;
        if (result.complete()) {
            try {
                savedPath = generationService.persistEquations(result, properties.getOutputDirectory());
            } catch (IllegalStateException ex) {
                throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
            }
        }

        log.info("Generated {} equations: {}", mode.label(), result.summary());

        List<String> equations = result.equations();
        return new GenerateResponse(
                mode.label(),
                mode.elementCount(),
                mode.attempts(),
                result.patternCount(),
                result.accepted(),
                result.examined(),
                result.totalCandidates(),
                result.complete(),
                result.summary(),
                result.elapsed().toMillis(),
                savedPath == null ? null : savedPath.toString(),
                List.copyOf(equations.subList(0, Math.min(SAMPLE_SIZE, equations.size()))));
    }

    @GetMapping(path = "/equations/{mode}")
    public ResponseEntity<byte[]> getEquations(@PathVariable("mode") String rawMode) {
        GameMode mode = parseMode(rawMode);
        Path path = GenerationService.equationsPath(mode, properties.getOutputDirectory());
        if (!Files.exists(path)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No " + mode.label() + " equations generated yet");
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_TYPE, CSV_MEDIA_TYPE)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + path.getFileName() + "\"")
                    .body(bytes);
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read equations", ex);
        }
    }

    @GetMapping(path = "/patterns/{mode}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PatternResponse> getPatterns(@PathVariable("mode") String rawMode) {
        GameMode mode = parseMode(rawMode);
        List<PatternResponse> patterns = new ArrayList<>();
        for (EquationPattern pattern : generationService.patterns(mode)) {
            patterns.add(new PatternResponse(
                    pattern.label(),
                    pattern.expressionLength(),
                    pattern.resultLength(),
                    pattern.candidateCount()));
        }
        return patterns;
    }

    private GameMode parseMode(String rawMode) {
        if (!StringUtils.hasText(rawMode)) {
            return GameMode.REGULAR;
        }
        try {
            return GameMode.parse(rawMode);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    private GenerationOptions buildOptions(GenerateRequest request, GameMode mode) {
        GenerationOptions.Builder builder = GenerationOptions.builder()
                .mode(mode)
                .parallelism(request.parallelism() != null ? request.parallelism() : properties.getParallelism());
        if (request.candidateLimit() != null) {
            builder.candidateLimit(request.candidateLimit());
        }
        return builder.build();
    }
}
