package com.trading.ccv.market;

import com.trading.ccv.error.NumericDomainException;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Term-structured zero curve: continuously-compounded zero rates at pillar
 * days, linearly interpolated in between and held flat outside the pillars.
 */
public final class ZeroCurve implements DiscountCurve {
    private final int[] pillarDays;
    private final double[] zeroRates;

    private ZeroCurve(int[] pillarDays, double[] zeroRates) {
        this.pillarDays = pillarDays;
        this.zeroRates = zeroRates;
    }

    /**
     * Builds a curve from a day to zero-rate map.
     *
     * @param pillars Pillar day offsets (non-negative) to zero rates.
     * @return The curve.
     */
    public static ZeroCurve of(Map<Integer, Double> pillars) {
        if (pillars == null || pillars.isEmpty()) {
            throw new IllegalArgumentException("Zero curve needs at least one pillar");
        }
        TreeMap<Integer, Double> sorted = new TreeMap<>(pillars);
        int[] days = new int[sorted.size()];
        double[] rates = new double[sorted.size()];
        int i = 0;
        for (Map.Entry<Integer, Double> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getKey() < 0) {
                throw new IllegalArgumentException("Pillar day must be >= 0, got " + e.getKey());
            }
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                throw new NumericDomainException("Zero rate at day " + e.getKey() + " must be finite");
            }
            days[i] = e.getKey();
            rates[i] = e.getValue();
            i++;
        }
        return new ZeroCurve(days, rates);
    }

    @Override
    public double zeroRate(double days) {
        if (days <= pillarDays[0]) {
            return zeroRates[0];
        }
        int last = pillarDays.length - 1;
        if (days >= pillarDays[last]) {
            return zeroRates[last];
        }
        int hi = 1;
        while (pillarDays[hi] < days) {
            hi++;
        }
        int lo = hi - 1;
        double w = (days - pillarDays[lo]) / (double) (pillarDays[hi] - pillarDays[lo]);
        return zeroRates[lo] + w * (zeroRates[hi] - zeroRates[lo]);
    }

    @Override
    public DiscountCurve shifted(double shift) {
        double[] bumped = new double[zeroRates.length];
        for (int i = 0; i < zeroRates.length; i++) {
            bumped[i] = zeroRates[i] + shift;
        }
        return new ZeroCurve(pillarDays, bumped);
    }

    @Override
    public String toString() {
        return "ZeroCurve" + Arrays.toString(pillarDays) + "=" + Arrays.toString(zeroRates);
    }
}
