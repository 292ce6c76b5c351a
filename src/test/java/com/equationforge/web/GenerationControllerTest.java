package com.equationforge.web;

import static org.junit.jupiter.api.Assertions.*;

import com.equationforge.config.AppProperties;
import com.equationforge.generator.GenerationOptions;
import com.equationforge.generator.GenerationResult;
import com.equationforge.generator.GenerationService;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.web.server.ResponseStatusException;

class GenerationControllerTest {

    @TempDir
    Path tempDir;

    private GenerationController controller;

    @BeforeEach
    void setUp() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.output-dir", tempDir.toString())
                .withProperty("app.parallelism", "2");
        controller = new GenerationController(new GenerationService(), new AppProperties(environment));
    }

    @Test
    void generatesAndServesMiniTable() {
        GenerateResponse response = controller.generate(new GenerateRequest("mini", null, null));

        assertEquals("mini", response.mode());
        assertEquals(6, response.elementCount());
        assertEquals(206, response.accepted());
        assertEquals(289_800, response.examined());
        assertTrue(response.complete());
        assertNotNull(response.savedPath());
        assertEquals(20, response.sampleEquations().size());
        assertEquals("1+9=10", response.sampleEquations().get(0));

        ResponseEntity<byte[]> csv = controller.getEquations("MINI");
        assertEquals(HttpStatus.OK, csv.getStatusCode());
        String body = new String(csv.getBody(), StandardCharsets.UTF_8);
        List<String> lines = body.lines().toList();
        assertEquals(207, lines.size());
        assertEquals("equation", lines.get(0));
        assertEquals("1+9=10", lines.get(1));
    }

    @Test
    void boundedRunIsNotPersisted() {
        GenerateResponse response = controller.generate(new GenerateRequest("mini", 1, 1_000L));

        assertFalse(response.complete());
        assertEquals(2_000, response.examined());
        assertNull(response.savedPath());
        assertFalse(Files.exists(tempDir.resolve("mini_equations.csv")));
    }

    @Test
    void unknownModeIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.generate(new GenerateRequest("huge", null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void invalidParallelismIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.generate(new GenerateRequest("mini", 0, null)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void missingTableIsNotFound() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getEquations("regular"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void listsPatternsWithCounts() {
        List<PatternResponse> patterns = controller.getPatterns("regular");
        assertEquals(3, patterns.size());
        assertEquals(4, patterns.get(0).expressionLength());
        assertEquals(15_876_000L, patterns.get(0).candidateCount());
    }

    @Test
    void missingBodyIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.generate(null));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void interruptedGenerationIsServerError() {
        GenerationService failing = new GenerationService() {
            @Override
            public GenerationResult runGeneration(GenerationOptions options) {
                throw new IllegalStateException("Generation interrupted");
            }
        };
        MockEnvironment environment = new MockEnvironment().withProperty("app.output-dir", tempDir.toString());
        GenerationController failingController = new GenerationController(failing, new AppProperties(environment));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> failingController.generate(new GenerateRequest("mini", 2, null)));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatusCode());
    }
}
