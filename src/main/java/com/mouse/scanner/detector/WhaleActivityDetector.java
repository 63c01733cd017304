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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags large-money option trades.
 * <p>
 * A contract qualifies when its notional value reaches the minimum and then EITHER its volume is an
 * unusual multiple of the baseline OR the raw volume alone reaches the minimum trade size.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WhaleActivityDetector implements Detector {

    private final ScannerConfig scannerConfig;
    private final OpportunityFactory opportunityFactory;

    @Override
    public String getAlertType() {
        return AlertType.WHALE_ACTIVITY.getCode();
    }

    @Override
    public Optional<Opportunity> evaluate(ScanCycle cycle, String symbol, OptionSnapshot snapshot) {
        long volume = snapshot.getVolume();
        if (volume <= 0) {
            return Optional.empty();
        }

        // Checked before the baseline lookup so small trades never cost a historical fetch
        if (snapshot.getNotionalValue() < scannerConfig.getMinNotionalValue()) {
            return Optional.empty();
        }

        BaselineVolume baseline = cycle.getBaselines().get(snapshot.contractKey());
        Double ratio = baseline.ratio(volume);
        boolean unusual = ratio != null && ratio >= scannerConfig.getUnusualVolumeMultiplier();

        // TODO: product owner to confirm whether absolute size alone should keep qualifying (over-reports cheap high-count prints)
        if (!unusual && volume < scannerConfig.getMinTradeSize()) {
            log.trace("{} below whale thresholds | ratio={} volume={}", snapshot.contractKey(), ratio, volume);
            return Optional.empty();
        }

        Opportunity opportunity = opportunityFactory.create(getAlertType(), cycle, snapshot, baseline, unusual);
        return Optional.of(opportunityFactory.score(opportunity));
    }
}
