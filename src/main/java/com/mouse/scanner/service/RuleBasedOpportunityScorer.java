package com.mouse.scanner.service;

import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.interfaces.OpportunityScorer;
import com.mouse.scanner.model.ScoreResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Heuristic success probability, used when no trained model is available.
 * Starts neutral at 50 and adds points for each bullish trait of the trade.
 */
@Service
@ConditionalOnProperty(name = "scanner.scoring.enabled", havingValue = "true")
public class RuleBasedOpportunityScorer implements OpportunityScorer {

    private static final double BASE_SCORE = 50.0;

    @Override
    public Optional<ScoreResult> score(Opportunity opportunity) {
        double score = BASE_SCORE;
        List<String> reasons = new ArrayList<>();

        long volume = opportunity.getVolume();
        long openInterest = opportunity.getOpenInterest();

        if (volume > 1000) {
            score += 5;
            reasons.add("High volume");
        }
        if (openInterest > 0 && (double) volume / openInterest > 0.5) {
            score += 10;
            reasons.add("Volume/OI ratio > 0.5");
        }
        if (opportunity.getImpliedVolatility() != null && opportunity.getImpliedVolatility() > 0.5) {
            score += 5;
            reasons.add("High implied volatility");
        }

        double underlying = opportunity.getUnderlyingPrice();
        if (underlying > 0) {
            if (opportunity.getOptionType() == OptionType.CALL && opportunity.getStrike() < underlying * 1.05) {
                score += 5;
                reasons.add("Call strike near or in-the-money");
            }
            if (opportunity.getOptionType() == OptionType.PUT && opportunity.getStrike() > underlying * 0.95) {
                score += 5;
                reasons.add("Put strike near or in-the-money");
            }
        }

        if (opportunity.getNotionalValue() > 1_000_000) {
            score += 10;
            reasons.add("Large notional value (whale activity)");
        }

        score = Math.min(score, 100.0);
        String reasoning = reasons.isEmpty()
                ? "Based on rule scoring: no bullish factors"
                : "Based on rule scoring: " + String.join(", ", reasons);

        return Optional.of(ScoreResult.builder()
                .successProbability(Math.round(score * 100.0) / 100.0)
                .confidence(confidenceFor(score))
                .reasoning(reasoning)
                .build());
    }

    /**
     * Distance from a coin flip decides the confidence label.
     */
    static String confidenceFor(double probability) {
        if (probability > 85 || probability < 15) {
            return "very high";
        } else if (probability > 75 || probability < 25) {
            return "high";
        } else if (probability > 65 || probability < 35) {
            return "medium";
        }
        return "low";
    }
}
