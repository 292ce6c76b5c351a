package com.equationforge.config;

import static org.junit.jupiter.api.Assertions.*;

import com.equationforge.generator.GameMode;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class AppPropertiesTest {

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        AppProperties properties = new AppProperties(new MockEnvironment());
        assertEquals(Path.of("equations"), properties.getOutputDirectory());
        assertTrue(properties.getParallelism() >= 1);
        assertTrue(properties.getStartupModes().isEmpty());
    }

    @Test
    void propertyKeysWinOverEnvironmentKeys() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.output-dir", "/tmp/eq")
                .withProperty("EQUATIONS_OUTPUT_DIR", "/ignored")
                .withProperty("GENERATOR_PARALLELISM", "3")
                .withProperty("GENERATE_ON_STARTUP", "mini, REGULAR,mini");
        AppProperties properties = new AppProperties(environment);
        assertEquals(Path.of("/tmp/eq"), properties.getOutputDirectory());
        assertEquals(3, properties.getParallelism());
        assertEquals(List.of(GameMode.MINI, GameMode.REGULAR), properties.getStartupModes());
    }

    @Test
    void rejectsInvalidParallelism() {
        MockEnvironment environment = new MockEnvironment().withProperty("app.parallelism", "zero");
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new AppProperties(environment));
        assertTrue(ex.getMessage().contains("Invalid parallelism"));
    }

    @Test
    void rejectsUnknownStartupMode() {
        MockEnvironment environment = new MockEnvironment().withProperty("app.generate-on-startup", "mini,huge");
        assertThrows(IllegalStateException.class, () -> new AppProperties(environment));
    }
}
