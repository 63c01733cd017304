package com.mouse.scanner.service;

import com.mouse.scanner.entity.BacktestResult;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.CategoryPerformance;
import com.mouse.scanner.model.Horizon;
import com.mouse.scanner.model.LeaderboardSummary;
import com.mouse.scanner.model.TopPerformer;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Pure reduction of backtest results into a leaderboard. No I/O, no state.
 */
@Component
public class PerformanceAggregator {

    private static final String UNKNOWN_ALERT_TYPE = "unknown";
    private static final int CATEGORY_TOP_SIZE = 5;

    private static final Comparator<BacktestResult> BY_DETECTION =
            Comparator.comparing(PerformanceAggregator::detectedAtOrMax)
                    .thenComparing(r -> r.getOpportunityId() == null ? Long.MAX_VALUE : r.getOpportunityId());

    /**
     * @param results        backtest results, may be empty
     * @param horizons       horizons to report, in display order
     * @param rankingHorizon horizon the top performers are ranked by
     * @param topSize        maximum length of the top performers list
     */
    public LeaderboardSummary build(Collection<BacktestResult> results, List<Horizon> horizons,
                                    Horizon rankingHorizon, int topSize, Instant generatedAt) {
        List<BacktestResult> all = results == null ? List.of() : new ArrayList<>(results);
        List<String> labels = labelsOf(horizons, rankingHorizon);

        Map<String, List<BacktestResult>> byAlertType = new TreeMap<>();
        for (BacktestResult result : all) {
            String alertType = result.getAlertType() == null ? UNKNOWN_ALERT_TYPE : result.getAlertType();
            byAlertType.computeIfAbsent(alertType, k -> new ArrayList<>()).add(result);
        }

        String rankingLabel = rankingHorizon.getLabel();
        Map<String, CategoryPerformance> categories = new LinkedHashMap<>();
        byAlertType.forEach((alertType, group) -> categories.put(alertType, CategoryPerformance.builder()
                .alertType(alertType)
                .count(group.size())
                .averageReturnByHorizon(averages(group, labels))
                .bestReturn(best(group, rankingLabel))
                .worstReturn(worst(group, rankingLabel))
                .winRate(winRate(group, rankingLabel))
                .totalNotionalValue(totalNotional(group))
                .topPerformers(rank(group, rankingLabel, Math.min(topSize, CATEGORY_TOP_SIZE)))
                .build()));

        return LeaderboardSummary.builder()
                .totalOpportunities(all.size())
                .averageReturnByHorizon(averages(all, labels))
                .sampleSizeByHorizon(sampleSizes(all, labels))
                .byAlertType(categories)
                .rankingHorizon(rankingLabel)
                .winRate(winRate(all, rankingLabel))
                .winRateByHorizon(winRates(all, labels))
                .bestReturn(best(all, rankingLabel))
                .worstReturn(worst(all, rankingLabel))
                .totalNotionalValue(totalNotional(all))
                .topPerformers(rank(all, rankingLabel, topSize))
                .generatedAt(generatedAt)
                .build();
    }

    /**
     * Results that reached the horizon, best return first. Ties go to the earlier detection.
     */
    public List<TopPerformer> rank(Collection<BacktestResult> results, String horizonLabel, int limit) {
        List<BacktestResult> ranked = new ArrayList<>();
        for (BacktestResult result : results) {
            if (result.returnAt(horizonLabel).isPresent()) {
                ranked.add(result);
            }
        }
        Comparator<BacktestResult> byReturnDesc =
                Comparator.comparing((BacktestResult r) -> r.returnAt(horizonLabel).orElseThrow()).reversed();
        ranked.sort(byReturnDesc.thenComparing(BY_DETECTION));

        List<TopPerformer> top = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < limit; i++) {
            BacktestResult result = ranked.get(i);
            Opportunity opportunity = result.getOpportunity();
            top.add(TopPerformer.builder()
                    .rank(i + 1)
                    .opportunityId(result.getOpportunityId())
                    .symbol(opportunity != null ? opportunity.getSymbol() : null)
                    .optionType(opportunity != null ? String.valueOf(opportunity.getOptionType()) : null)
                    .strike(opportunity != null ? opportunity.getStrike() : 0.0)
                    .expiration(opportunity != null ? opportunity.getExpiration() : null)
                    .alertType(result.getAlertType())
                    .detectedAt(result.getDetectedAt())
                    .returnPct(result.returnAt(horizonLabel).orElseThrow())
                    .build());
        }
        return top;
    }

    private static List<String> labelsOf(List<Horizon> horizons, Horizon rankingHorizon) {
        List<String> labels = new ArrayList<>();
        for (Horizon horizon : horizons) {
            if (!labels.contains(horizon.getLabel())) {
                labels.add(horizon.getLabel());
            }
        }
        if (!labels.contains(rankingHorizon.getLabel())) {
            labels.add(rankingHorizon.getLabel());
        }
        return labels;
    }

    // Only horizons with at least one sample appear in the map
    private static Map<String, Double> averages(List<BacktestResult> results, List<String> labels) {
        Map<String, Double> averages = new LinkedHashMap<>();
        for (String label : labels) {
            double sum = 0;
            int count = 0;
            for (BacktestResult result : results) {
                Optional<Double> value = result.returnAt(label);
                if (value.isPresent()) {
                    sum += value.get();
                    count++;
                }
            }
            if (count > 0) {
                averages.put(label, sum / count);
            }
        }
        return averages;
    }

    private static Map<String, Integer> sampleSizes(List<BacktestResult> results, List<String> labels) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (String label : labels) {
            int count = (int) results.stream().filter(r -> r.returnAt(label).isPresent()).count();
            if (count > 0) {
                sizes.put(label, count);
            }
        }
        return sizes;
    }

    private static Double best(List<BacktestResult> results, String label) {
        return results.stream()
                .map(r -> r.returnAt(label))
                .flatMap(Optional::stream)
                .max(Double::compare)
                .orElse(null);
    }

    private static Double worst(List<BacktestResult> results, String label) {
        return results.stream()
                .map(r -> r.returnAt(label))
                .flatMap(Optional::stream)
                .min(Double::compare)
                .orElse(null);
    }

    private static double totalNotional(List<BacktestResult> results) {
        return results.stream()
                .map(BacktestResult::getOpportunity)
                .filter(Objects::nonNull)
                .mapToDouble(Opportunity::getNotionalValue)
                .sum();
    }

    private static Map<String, Double> winRates(List<BacktestResult> results, List<String> labels) {
        Map<String, Double> rates = new LinkedHashMap<>();
        for (String label : labels) {
            Double rate = winRate(results, label);
            if (rate != null) {
                rates.put(label, rate);
            }
        }
        return rates;
    }

    private static Double winRate(List<BacktestResult> results, String label) {
        int samples = 0;
        int wins = 0;
        for (BacktestResult result : results) {
            Optional<Double> value = result.returnAt(label);
            if (value.isPresent()) {
                samples++;
                if (value.get() > 0) {
                    wins++;
                }
            }
        }
        return samples == 0 ? null : wins * 100.0 / samples;
    }

    private static Instant detectedAtOrMax(BacktestResult result) {
        return result.getDetectedAt() == null ? Instant.MAX : result.getDetectedAt();
    }
}
