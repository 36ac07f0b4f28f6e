package com.trading.ccv.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Tunables of the valuation engine and the Greeks aggregator.
 *
 * <p>
 * Bound from JSON by {@link ValuationConfigReader}; fields absent from the
 * document keep the defaults below.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValuationConfig {
    /** Deepest contract tree accepted by the pre-pass. */
    private int maxDepth = 512;
    /** Node visits accepted by the pre-pass; shared subtrees count each time they are reached. */
    private int maxNodes = 1_000_000;
    /** Reject approximated constructs instead of valuing them. */
    private boolean strict;
    /** Spacing, in days, of the trigger scan of {@code When}. */
    private int triggerStepDays = 1;
    /** Furthest day an unbounded {@code When} or {@code Anytime} looks at. */
    private int maxHorizonDays = 3650;
    /** Candidate exercise days of {@code Anytime}, both ends included. */
    private int exerciseGridPoints = 64;
    /** Worker threads for bump scenarios; 1 runs them on the caller. */
    private int parallelism = 1;

    public static ValuationConfig defaults() {
        return new ValuationConfig();
    }

    /** Field-by-field copy; the engine keeps one so later setter calls do not reach it. */
    public ValuationConfig copy() {
        ValuationConfig c = new ValuationConfig();
        c.setMaxDepth(maxDepth);
        c.setMaxNodes(maxNodes);
        c.setStrict(strict);
        c.setTriggerStepDays(triggerStepDays);
        c.setMaxHorizonDays(maxHorizonDays);
        c.setExerciseGridPoints(exerciseGridPoints);
        c.setParallelism(parallelism);
        return c;
    }

    /**
     * Checks ranges. Called by the reader and by the engine constructor.
     *
     * @throws IllegalArgumentException naming the first offending field.
     */
    public ValuationConfig validate() {
        requirePositive(maxDepth, "maxDepth");
        requirePositive(maxNodes, "maxNodes");
        requirePositive(triggerStepDays, "triggerStepDays");
        if (maxHorizonDays < 0) {
            throw new IllegalArgumentException("maxHorizonDays must be >= 0, got " + maxHorizonDays);
        }
        if (exerciseGridPoints < 2) {
            throw new IllegalArgumentException("exerciseGridPoints must be >= 2, got " + exerciseGridPoints);
        }
        requirePositive(parallelism, "parallelism");
        return this;
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be > 0, got " + value);
        }
    }
}
