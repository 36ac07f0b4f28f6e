package com.trading.ccv.wiring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.trading.ccv.model.Contract;

/**
 * Named contracts revalued together. Immutable; iteration follows insertion
 * order.
 */
public final class Portfolio {
    private final Map<String, Contract> positions;

    private Portfolio(Map<String, Contract> positions) {
        this.positions = Collections.unmodifiableMap(positions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Contract> positions() {
        return positions;
    }

    public Contract get(String name) {
        return positions.get(name);
    }

    public int size() {
        return positions.size();
    }

    public static final class Builder {
        private final Map<String, Contract> positions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String name, Contract contract) {
            Objects.requireNonNull(contract, "contract");
            if (positions.putIfAbsent(Objects.requireNonNull(name, "name"), contract) != null) {
                throw new IllegalArgumentException("Duplicate position name: " + name);
            }
            return this;
        }

        public Portfolio build() {
            return new Portfolio(new LinkedHashMap<>(positions));
        }
    }
}
