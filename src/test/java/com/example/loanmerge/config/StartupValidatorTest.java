package com.example.loanmerge.config;

import com.example.loanmerge.PoolFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupValidatorTest {

    @TempDir
    Path tempDir;

    private AppProperties config;

    @BeforeEach
    void setUp() throws IOException {
        PoolFixtures.writeMatchedPool(tempDir);
        config = PoolFixtures.properties(tempDir);
    }

    @Test
    void validConfigPasses() {
        assertDoesNotThrow(() -> StartupValidator.validate(config));
    }

    @Test
    void unknownStageIsRejected() {
        config.setStages(List.of("POOL", "SORT"));

        assertThrows(IllegalStateException.class, () -> StartupValidator.validate(config));
    }

    @Test
    void countryBeforePoolIsRejected() {
        config.setStages(List.of("COUNTRY", "POOL"));

        assertThrows(IllegalStateException.class, () -> StartupValidator.validate(config));
    }

    @Test
    void countryOnlyRunDoesNotNeedSources() throws IOException {
        config.setStages(List.of("COUNTRY"));
        Files.delete(tempDir.resolve("template.csv"));

        assertDoesNotThrow(() -> StartupValidator.validate(config));
    }

    @Test
    void missingTemplateIsRejected() throws IOException {
        Files.delete(tempDir.resolve("template.csv"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupValidator.validate(config));
        assertTrue(e.getMessage().contains("app.mapping.template-path"));
    }

    @Test
    void countryDirInsidePoolDirIsRejected() {
        config.getOutput().setCountryDir(tempDir.resolve("out/pools/countries").toString());

        assertThrows(IllegalStateException.class, () -> StartupValidator.validate(config));
    }

    @Test
    void nonPositiveChunkRowsIsRejected() {
        config.getPerformance().setChunkRows(0);

        assertThrows(IllegalStateException.class, () -> StartupValidator.validate(config));
    }
}
