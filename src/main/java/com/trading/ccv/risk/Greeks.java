package com.trading.ccv.risk;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of sensitivities, one entry per {@link Greek}.
 *
 * <p>
 * Greeks are linear in the contract, so they compose the way values do:
 * {@link #plus(Greeks)} for {@code And}, {@link #negate()} for {@code Give} and
 * {@link #scale(double)} for {@code Scale} with a fixed factor.
 */
public final class Greeks {
    public static final Greeks ZERO = new Greeks(new EnumMap<>(Greek.class));

    private final EnumMap<Greek, Double> values;

    private Greeks(EnumMap<Greek, Double> values) {
        for (Greek g : Greek.values()) {
            values.putIfAbsent(g, 0.0);
        }
        this.values = values;
    }

    public static Greeks of(double delta, double gamma, double vega, double theta, double rho) {
        EnumMap<Greek, Double> m = new EnumMap<>(Greek.class);
        m.put(Greek.DELTA, delta);
        m.put(Greek.GAMMA, gamma);
        m.put(Greek.VEGA, vega);
        m.put(Greek.THETA, theta);
        m.put(Greek.RHO, rho);
        return new Greeks(m);
    }

    public double get(Greek greek) {
        return values.get(greek);
    }

    public double delta() {
        return get(Greek.DELTA);
    }

    public double gamma() {
        return get(Greek.GAMMA);
    }

    public double vega() {
        return get(Greek.VEGA);
    }

    public double theta() {
        return get(Greek.THETA);
    }

    public double rho() {
        return get(Greek.RHO);
    }

    public Greeks plus(Greeks other) {
        EnumMap<Greek, Double> m = new EnumMap<>(Greek.class);
        for (Greek g : Greek.values()) {
            m.put(g, get(g) + other.get(g));
        }
        return new Greeks(m);
    }

    public Greeks negate() {
        return scale(-1.0);
    }

    public Greeks scale(double factor) {
        EnumMap<Greek, Double> m = new EnumMap<>(Greek.class);
        for (Greek g : Greek.values()) {
            m.put(g, get(g) * factor);
        }
        return new Greeks(m);
    }

    /**
     * Keeps theta and rho, zeroes the spot and volatility Greeks. Used when a
     * sub-contract does not reference the underlying being asked about.
     */
    public Greeks timeAndRateOnly() {
        return of(0.0, 0.0, 0.0, theta(), rho());
    }

    /** Read-only view keyed by lower-case Greek name, in declaration order. */
    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (Greek g : Greek.values()) {
            m.put(g.key(), get(g));
        }
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Greeks other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Greeks{delta=%.6f, gamma=%.6f, vega=%.6f, theta=%.6f, rho=%.6f}",
                delta(), gamma(), vega(), theta(), rho());
    }
}
