package com.mouse.scanner.detector;

import com.mouse.scanner.config.ScannerConfig;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.enums.AlertType;
import com.mouse.scanner.interfaces.Detector;
import com.mouse.scanner.model.BaselineVolume;
import com.mouse.scanner.model.OptionSnapshot;
import com.mouse.scanner.model.ScanCycle;
import com.mouse.scanner.utils.OpportunityFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Liquid, volatile contracts suitable for intraday momentum trades: enough volume, enough open
 * interest and implied volatility above the configured level.
 */
@Component
@RequiredArgsConstructor
public class DayTradingDetector implements Detector {

    private final ScannerConfig scannerConfig;
    private final OpportunityFactory opportunityFactory;

    @Override
    public String getAlertType() {
        return AlertType.DAY_TRADING.getCode();
    }

    @Override
    public Optional<Opportunity> evaluate(ScanCycle cycle, String symbol, OptionSnapshot snapshot) {
        if (!meetsCriteria(snapshot)) {
            return Optional.empty();
        }

        BaselineVolume baseline = cycle.getBaselines().get(snapshot.contractKey());
        Double ratio = baseline.ratio(snapshot.getVolume());
        boolean unusual = ratio != null && ratio >= scannerConfig.getUnusualVolumeMultiplier();

        Opportunity opportunity = opportunityFactory.create(getAlertType(), cycle, snapshot, baseline, unusual);
        return Optional.of(opportunityFactory.score(opportunity));
    }

    boolean meetsCriteria(OptionSnapshot snapshot) {
        if (snapshot.getVolume() <= 0 || snapshot.getVolume() < scannerConfig.getDayTradingMinVolume()) {
            return false;
        }
        if (snapshot.getOpenInterest() < scannerConfig.getDayTradingMinOpenInterest()) {
            return false;
        }
        // No greeks means no IV to judge by
        if (snapshot.getGreeks() == null) {
            return false;
        }
        double minIv = scannerConfig.getDayTradingMinIvPercentile() / 100.0;
        return snapshot.getGreeks().getImpliedVolatility() >= minIv;
    }
}
