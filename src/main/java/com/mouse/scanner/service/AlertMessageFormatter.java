package com.mouse.scanner.service;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.CategoryPerformance;
import com.mouse.scanner.model.LeaderboardSummary;
import com.mouse.scanner.model.TopPerformer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Renders opportunities and leaderboards as Telegram HTML text.
 */
@Component
@RequiredArgsConstructor
public class AlertMessageFormatter {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.of("America/New_York"));

    private static final String EMOJI_ALERT = "🚨";
    private static final String EMOJI_PRICE = "💰";
    private static final String EMOJI_VOLUME = "📊";
    private static final String EMOJI_NOTIONAL = "💵";
    private static final String EMOJI_CLOCK = "⏰";
    private static final String EMOJI_CHART = "📈";
    private static final String EMOJI_TROPHY = "🏆";

    private final ScannerConfig scannerConfig;

    public String formatOpportunity(Opportunity opportunity) {
        StringBuilder message = new StringBuilder();
        String alertType = opportunity.getAlertType().toUpperCase(Locale.ROOT).replace('_', ' ');

        message.append(EMOJI_ALERT).append(" <b>").append(alertType).append(" ALERT</b> ").append(EMOJI_ALERT).append("\n\n");
        message.append("<b>").append(opportunity.getSymbol()).append(' ')
                .append(opportunity.getOptionType()).append(' ')
                .append(String.format(Locale.US, "$%.2f", opportunity.getStrike())).append(' ')
                .append(opportunity.getExpiration()).append("</b>\n\n");
        message.append(String.format(Locale.US, "%s Price: $%.2f%n", EMOJI_PRICE, opportunity.getPrice()));
        message.append(String.format(Locale.US, "%s Volume: %,d%n", EMOJI_VOLUME, opportunity.getVolume()));
        message.append(String.format(Locale.US, "%s Notional Value: $%,.2f%n", EMOJI_NOTIONAL, opportunity.getNotionalValue()));

        if (opportunity.getVolumeRatio() != null) {
            message.append(String.format(Locale.US, "Volume vs %d-day avg: %.1fx%s%n",
                    scannerConfig.getBaselineLookbackDays(), opportunity.getVolumeRatio(), opportunity.isUnusualVolume() ? " (unusual)" : ""));
        } else {
            message.append("Volume baseline: insufficient history\n");
        }

        if (opportunity.isScored()) {
            double probability = opportunity.getSuccessProbability();
            message.append("\n<b>AI ANALYSIS</b> ").append(probabilityEmoji(probability)).append('\n');
            message.append(String.format(Locale.US, "Success Probability: <b>%.1f%%</b> (%s)%n", probability,
                    opportunity.getScoreConfidence() == null ? "" : opportunity.getScoreConfidence().toUpperCase(Locale.ROOT)));
            if (opportunity.getScoreReasoning() != null) {
                message.append(opportunity.getScoreReasoning()).append('\n');
            }
        }

        message.append('\n').append(EMOJI_CLOCK).append(" Alert Time: ").append(TIME_FORMAT.format(opportunity.getDetectedAt()));
        return message.toString();
    }

    public String formatLeaderboard(LeaderboardSummary summary) {
        StringBuilder message = new StringBuilder();
        message.append(EMOJI_CHART).append(" <b>PERFORMANCE LEADERBOARD</b> ").append(EMOJI_CHART).append("\n\n");
        message.append("Total Opportunities: ").append(summary.getTotalOpportunities()).append('\n');
        message.append(String.format(Locale.US, "Total Notional: $%,.0f%n%n", summary.getTotalNotionalValue()));

        if (summary.getAverageReturnByHorizon().isEmpty()) {
            message.append("No backtested horizons yet.\n");
        } else {
            message.append("<b>Average Return by Horizon:</b>\n");
            for (Map.Entry<String, Double> entry : summary.getAverageReturnByHorizon().entrySet()) {
                message.append(String.format(Locale.US, "  %s: %+.2f%% (n=%d)%n", entry.getKey(), entry.getValue(),
                        summary.getSampleSizeByHorizon().getOrDefault(entry.getKey(), 0)));
            }
        }

        if (summary.getWinRate() != null) {
            message.append(String.format(Locale.US, "Win rate @%s: %.1f%%%n", summary.getRankingHorizon(), summary.getWinRate()));
        }

        if (!summary.getTopPerformers().isEmpty()) {
            message.append('\n').append(EMOJI_TROPHY).append(" <b>Top Performers (")
                    .append(summary.getRankingHorizon()).append("):</b>\n");
            for (TopPerformer performer : summary.getTopPerformers()) {
                message.append(String.format(Locale.US, "%d. %s %s $%.2f %s - %+.2f%%%n",
                        performer.getRank(), performer.getSymbol(), performer.getOptionType(),
                        performer.getStrike(), performer.getAlertType(), performer.getReturnPct()));
            }
        }

        if (!summary.getByAlertType().isEmpty()) {
            message.append("\n<b>By Alert Type:</b>\n");
            for (CategoryPerformance category : summary.getByAlertType().values()) {
                Double avg = category.getAverageReturnByHorizon().get(summary.getRankingHorizon());
                message.append(String.format(Locale.US, "  %s: %d alerts, avg %s, best %s, worst %s, win rate %s%n",
                        category.getAlertType(), category.getCount(),
                        percent(avg), percent(category.getBestReturn()), percent(category.getWorstReturn()),
                        category.getWinRate() == null ? "n/a" : String.format(Locale.US, "%.1f%%", category.getWinRate())));
            }
        }
        return message.toString();
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : String.format(Locale.US, "%+.2f%%", value);
    }

    static String probabilityEmoji(double probability) {
        if (probability >= 70) {
            return "🔥";
        } else if (probability >= 60) {
            return "✅";
        } else if (probability >= 40) {
            return "⚠️";
        }
        return "❌";
    }
}
