package com.trading.ccv;

import java.util.Objects;

import com.trading.ccv.model.Value;
import com.trading.ccv.risk.Greeks;

/**
 * Value and net Greeks of one contract on one snapshot.
 */
public record ValuationResult(Value value, Greeks greeks) {

    public ValuationResult {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(greeks, "greeks");
    }
}
