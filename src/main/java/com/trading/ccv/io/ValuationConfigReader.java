package com.trading.ccv.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Loads {@link ValuationConfig} from JSON.
 *
 * <p>
 * {@link #loadDefault()} reads the classpath resource {@value #DEFAULT_RESOURCE}
 * and falls back to built-in defaults when it is absent.
 */
@Log4j2
public final class ValuationConfigReader {
    public static final String DEFAULT_RESOURCE = "valuation.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValuationConfigReader() {
        // Utility class
    }

    public static ValuationConfig loadDefault() {
        InputStream in = ValuationConfigReader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            log.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            return ValuationConfig.defaults();
        }
        try (in) {
            ValuationConfig config = MAPPER.readValue(in, ValuationConfig.class).validate();
            log.info("Loaded valuation config from classpath:{} -> {}", DEFAULT_RESOURCE, config);
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static ValuationConfig read(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read valuation config " + path, e);
        }
    }

    public static ValuationConfig parse(String json) {
        try {
            return MAPPER.readValue(json, ValuationConfig.class).validate();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed valuation config: " + e.getOriginalMessage(), e);
        }
    }
}
