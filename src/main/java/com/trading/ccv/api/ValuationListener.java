package com.trading.ccv.api;

import com.trading.ccv.model.Value;

/**
 * Observability hook for portfolio revaluation passes.
 *
 * <p>
 * Callbacks run on the revaluation thread, inside the pass. Implementations
 * must be cheap and must not block; anything slow belongs on another thread.
 */
public interface ValuationListener {

    /**
     * Called before the first contract of a pass is valued.
     *
     * @param epoch incrementing pass number.
     */
    void onRevaluationStart(long epoch);

    /**
     * Called after one contract was valued.
     *
     * @param durationNanos wall time of this contract's valuation.
     */
    void onContractValued(long epoch, String name, Value value, long durationNanos);

    /**
     * Called when valuing one contract failed. The pass continues with the
     * next contract.
     */
    void onContractError(long epoch, String name, Throwable error);

    /**
     * Called when the pass is complete.
     *
     * @param contractsValued contracts that produced a value this pass.
     */
    void onRevaluationEnd(long epoch, int contractsValued);
}
