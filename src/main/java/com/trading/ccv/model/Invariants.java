package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;
import com.trading.ccv.error.NegativeTimeOffsetException;

/**
 * Construction-time invariant checks shared by the combinator records.
 */
final class Invariants {
    private Invariants() {
        // Utility class
    }

    static void requireChild(Contract child, String combinator) {
        if (child == null) {
            throw new MalformedContractException(combinator + " requires a non-null sub-contract");
        }
    }

    static void requireDay(int day, String what) {
        if (day < 0) {
            throw new NegativeTimeOffsetException(what, day);
        }
    }

    static void requireCondition(Observable condition, String combinator) {
        if (condition == null || !condition.isBoolean()) {
            throw new MalformedContractException(combinator + " requires a boolean condition, got " + condition);
        }
    }
}
