package com.mouse.scanner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Performance of one alert type across its backtested opportunities.
 */
@Value
@Builder
public class CategoryPerformance {
    String alertType;
    int count;
    // horizon label -> mean return %, only horizons with at least one sample
    Map<String, Double> averageReturnByHorizon;
    // best and worst single return at the ranking horizon, null when no result reached it
    Double bestReturn;
    Double worstReturn;
    // share of positive returns at the ranking horizon, null without samples
    Double winRate;
    double totalNotionalValue;
    List<TopPerformer> topPerformers;
}
