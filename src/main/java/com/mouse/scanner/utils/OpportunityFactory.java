package com.mouse.scanner.utils;

import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.exception.ScoringUnavailableException;
import com.mouse.scanner.interfaces.OpportunityScorer;
import com.mouse.scanner.model.BaselineVolume;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.model.ScanCycle;
import com.mouse.scanner.model.ScoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Shared emission steps for all detectors: build the opportunity from the snapshot and its baseline,
 * then ask the scorer, if one is wired, for a success probability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpportunityFactory {

    private final Optional<OpportunityScorer> scorer;

    public Opportunity create(String alertType, ScanCycle cycle, OptionSnapshot snapshot,
                              BaselineVolume baseline, boolean unusualVolume) {
        Instant detectedAt = snapshot.getTimestamp() != null ? snapshot.getTimestamp() : cycle.getStartedAt();

        return Opportunity.builder()
                .symbol(snapshot.getSymbol())
                .optionSymbol(snapshot.getOptionSymbol())
                .optionType(snapshot.getOptionType())
                .strike(snapshot.getStrike())
                .expiration(snapshot.getExpiration())
                .detectedAt(detectedAt)
                .price(snapshot.getPrice())
                .volume(snapshot.getVolume())
                .openInterest(snapshot.getOpenInterest())
                .notionalValue(snapshot.getNotionalValue())
                .underlyingPrice(snapshot.getUnderlyingPrice())
                .impliedVolatility(snapshot.getGreeks() != null ? snapshot.getGreeks().getImpliedVolatility() : null)
                .baselineAverageVolume(baseline.isKnown() ? baseline.getAverageVolume() : null)
                .volumeRatio(baseline.ratio(snapshot.getVolume()))
                .alertType(alertType)
                .unusualVolume(unusualVolume)
                .build();
    }

    /**
     * Attaches a score when the scorer is present and answers. Never fails the caller.
     */
    public Opportunity score(Opportunity opportunity) {
        if (scorer.isEmpty()) {
            return opportunity;
        }
        try {
            Optional<ScoreResult> result = scorer.get().score(opportunity);
            result.ifPresent(opportunity::attachScore);
        } catch (ScoringUnavailableException e) {
            log.info("Scoring unavailable for {}: {}", opportunity.contractKey(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Scorer failed for {}, emitting without probability", opportunity.contractKey(), e);
        }
        return opportunity;
    }
}
