package com.trading.ccv.io;

import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Test;

public class ValuationConfigReaderTest {

    @Test
    public void testClasspathDefaults() {
        ValuationConfig cfg = ValuationConfigReader.loadDefault();
        assertEquals(ValuationConfig.defaults(), cfg);
        assertEquals(512, cfg.getMaxDepth());
        assertEquals(64, cfg.getExerciseGridPoints());
        assertFalse(cfg.isStrict());
    }

    @Test
    public void testPartialDocumentKeepsDefaults() {
        ValuationConfig cfg = ValuationConfigReader.parse("{\"strict\": true, \"parallelism\": 4, \"comment\": \"x\"}");
        assertTrue(cfg.isStrict());
        assertEquals(4, cfg.getParallelism());
        assertEquals(3650, cfg.getMaxHorizonDays());
        assertEquals(1, cfg.getTriggerStepDays());
    }

    @Test
    public void testReadFromFile() throws Exception {
        Path file = Files.createTempFile("valuation", ".json");
        try {
            Files.writeString(file, "{\"maxHorizonDays\": 0}");
            assertEquals(0, ValuationConfigReader.read(file).getMaxHorizonDays());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        ValuationConfigReader.parse("{\"maxDepth\": ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongType() {
        ValuationConfigReader.parse("{\"maxDepth\": \"deep\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGridNeedsTwoPoints() {
        ValuationConfigReader.parse("{\"exerciseGridPoints\": 1}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveStep() {
        ValuationConfigReader.parse("{\"triggerStepDays\": 0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingFile() {
        ValuationConfigReader.read(Path.of("does-not-exist.json"));
    }
}
