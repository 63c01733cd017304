package com.mouse.scanner.interfaces;

import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.model.ScanCycle;

import java.util.Optional;

/**
 * Turns one option-chain snapshot into at most one opportunity.
 * <p>
 * Every Spring bean implementing this interface is run by the scan orchestrator, so a new detector is
 * added by declaring a component; the orchestrator does not change.
 */
public interface Detector {

    /** Alert type stamped on the opportunities this detector emits. */
    String getAlertType();

    /**
     * @param cycle    current scan cycle, gives access to the per-cycle baseline cache
     * @param symbol   watchlist symbol the chain was fetched for
     * @param snapshot contract to evaluate
     */
    Optional<Opportunity> evaluate(ScanCycle cycle, String symbol, OptionSnapshot snapshot);
}
