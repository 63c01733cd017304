package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated backtest performance. Derived on demand, never the source of truth.
 * <p>
 * Every average is taken only over results that have a value for that horizon, so
 * {@link #sampleSizeByHorizon} may differ per horizon and from {@link #totalOpportunities}.
 */
@Value
@Builder
public class LeaderboardSummary {
    int totalOpportunities;
    Map<String, Double> averageReturnByHorizon;
    Map<String, Integer> sampleSizeByHorizon;
    Map<String, CategoryPerformance> byAlertType;
    String rankingHorizon;
    // share of results with a positive return at the ranking horizon, null without samples
    Double winRate;
    // horizon label -> win rate %, only horizons with at least one sample
    Map<String, Double> winRateByHorizon;
    Double bestReturn;
    Double worstReturn;
    double totalNotionalValue;
    List<TopPerformer> topPerformers;
    Instant generatedAt;
}
