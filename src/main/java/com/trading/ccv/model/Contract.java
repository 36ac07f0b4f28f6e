package com.trading.ccv.model;

/**
 * A financial contract built from the ten primitive combinators.
 *
 * <p>
 * Contracts are immutable trees. Composition always allocates a new node and
 * may share existing children by reference, so one contract instance can be
 * valued concurrently from many threads.
 *
 * <p>
 * The default methods are operator-style shorthands; {@code a.and(b)} is the
 * same value as {@code new And(a, b)}.
 */
public sealed interface Contract permits Zero, One, Give, And, Or, Then, Scale, When, Truncate, Anytime {

    ContractKind kind();

    default Contract and(Contract other) {
        return new And(this, other);
    }

    default Contract or(Contract other) {
        return new Or(this, other);
    }

    default Contract give() {
        return new Give(this);
    }

    default Contract scale(Observable observable) {
        return new Scale(observable, this);
    }

    default Contract scale(double factor) {
        return new Scale(new Constant(factor), this);
    }

    default Contract then(int day) {
        return new Then(day, this);
    }

    default Contract truncate(int day) {
        return new Truncate(day, this);
    }
}
