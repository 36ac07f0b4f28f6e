package com.trading.ccv.market;

import static org.junit.Assert.*;

import java.time.LocalDate;
import java.util.Map;

import org.junit.Test;

import com.trading.ccv.error.MarketModelIncompleteException;
import com.trading.ccv.error.NonPositiveVolatilityException;
import com.trading.ccv.error.NumericDomainException;
import com.trading.ccv.error.UnknownUnderlyingException;
import com.trading.ccv.model.Currency;

public class MarketModelTest {
    private static final double EPS = 1e-12;

    private static MarketModel market() {
        return MarketModel.builder()
                .evaluationDate(LocalDate.of(2024, 1, 2))
                .baseCurrency(Currency.USD)
                .flatRate(0.05)
                .underlying("SPX", 100.0, 0.25, 0.02)
                .fxRate(Currency.EUR, 1.1)
                .build();
    }

    @Test
    public void testDiscountFactorFlatCurve() {
        MarketModel m = market();
        assertEquals(1.0, m.discountFactor(0), EPS);
        assertEquals(Math.exp(-0.05), m.discountFactor(365), EPS);
        assertEquals(0.05, m.zeroRate(180), EPS);
    }

    @Test
    public void testForwardIncludesCarry() {
        MarketModel m = market();
        double expected = 100.0 * Math.exp((0.05 - 0.02) * 90 / 365.0);
        assertEquals(expected, m.forward("SPX", 90), 1e-10);
    }

    @Test
    public void testAsOfRollsSpotToForwardAndKeepsVolatility() {
        MarketModel m = market();
        MarketModel rolled = m.asOf(90);
        assertEquals(m.forward("SPX", 90), rolled.spot("SPX"), 1e-10);
        assertEquals(0.25, rolled.volatility("SPX"), EPS);
        assertEquals(LocalDate.of(2024, 4, 1), rolled.evaluationDate());
        assertEquals(m.discountFactor(120) / m.discountFactor(90), rolled.discountFactor(30), EPS);
        // receiver untouched
        assertEquals(100.0, m.spot("SPX"), EPS);
    }

    @Test
    public void testBumpsReturnNewSnapshots() {
        MarketModel m = market();
        MarketModel up = m.withSpot("SPX", 101.0).withVolatility("SPX", 0.3).withRateShift(0.01);
        assertEquals(101.0, up.spot("SPX"), EPS);
        assertEquals(0.3, up.volatility("SPX"), EPS);
        assertEquals(Math.exp(-0.06), up.discountFactor(365), EPS);
        assertEquals(100.0, m.spot("SPX"), EPS);
        assertEquals(Math.exp(-0.05), m.discountFactor(365), EPS);
    }

    @Test
    public void testTimeShiftKeepsSpots() {
        MarketModel m = market();
        MarketModel later = m.withTimeShift(1);
        assertEquals(100.0, later.spot("SPX"), EPS);
        assertEquals(LocalDate.of(2024, 1, 3), later.evaluationDate());
    }

    @Test
    public void testUndatedSnapshotUsesFixedDate() {
        MarketModel m = MarketModel.builder().flatRate(0.05).build();
        assertEquals(MarketModel.DEFAULT_EVALUATION_DATE, m.evaluationDate());
        assertEquals(LocalDate.of(1970, 1, 31), m.asOf(30).evaluationDate());
    }

    @Test
    public void testZeroCurveInterpolatesAndDiscountsFromSnapshotDate() {
        MarketModel m = MarketModel.builder()
                .curve(ZeroCurve.of(Map.of(0, 0.03, 365, 0.05)))
                .build();
        assertEquals(0.04, m.curve().zeroRate(182.5), EPS);
        assertEquals(Math.exp(-0.05), m.discountFactor(365), EPS);
        assertEquals(0.05, m.curve().zeroRate(1000), EPS);
        double rolled = m.asOf(100).discountFactor(50);
        assertEquals(m.discountFactor(150) / m.discountFactor(100), rolled, EPS);
    }

    @Test
    public void testFxRates() {
        MarketModel m = market();
        assertEquals(1.0, m.fxRate(Currency.USD), EPS);
        assertEquals(1.1, m.fxRate(Currency.EUR), EPS);
        try {
            m.fxRate(Currency.JPY);
            fail("Expected MarketModelIncompleteException");
        } catch (MarketModelIncompleteException e) {
            assertEquals(java.util.List.of("JPY"), e.getMissingCurrencies());
        }
    }

    @Test(expected = UnknownUnderlyingException.class)
    public void testUnknownUnderlying() {
        market().spot("NDX");
    }

    @Test(expected = NonPositiveVolatilityException.class)
    public void testZeroVolatilityRejected() {
        MarketModel.builder().flatRate(0.01).underlying("X", 10.0, 0.0);
    }

    @Test(expected = NumericDomainException.class)
    public void testNegativeSpotRejected() {
        MarketModel.builder().flatRate(0.01).underlying("X", -1.0, 0.2);
    }

    @Test(expected = NumericDomainException.class)
    public void testDegenerateDiscountFactorRejected() {
        MarketModel.builder().flatRate(1e6).build().discountFactor(3650);
    }

    @Test(expected = IllegalStateException.class)
    public void testCurveRequired() {
        MarketModel.builder().underlying("X", 10.0, 0.2).build();
    }
}
