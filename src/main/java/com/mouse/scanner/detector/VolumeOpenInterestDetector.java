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
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Opt-in detector: today's volume is a large multiple of the open interest, i.e. mostly new positions.
 * Needs no history, so it works on contracts whose baseline is still unknown.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.volume-oi.enabled", havingValue = "true")
public class VolumeOpenInterestDetector implements Detector {

    private final ScannerConfig scannerConfig;
    private final OpportunityFactory opportunityFactory;

    @Override
    public String getAlertType() {
        return AlertType.VOLUME_OI_SPIKE.getCode();
    }

    @Override
    public Optional<Opportunity> evaluate(ScanCycle cycle, String symbol, OptionSnapshot snapshot) {
        long volume = snapshot.getVolume();
        long openInterest = snapshot.getOpenInterest();
        if (volume < scannerConfig.getMinTradeSize() || openInterest <= 0) {
            return Optional.empty();
        }
        if ((double) volume / openInterest < scannerConfig.getVolumeOpenInterestMinRatio()) {
            return Optional.empty();
        }

        BaselineVolume baseline = cycle.getBaselines().get(snapshot.contractKey());
        Double ratio = baseline.ratio(volume);
        boolean unusual = ratio != null && ratio >= scannerConfig.getUnusualVolumeMultiplier();

        Opportunity opportunity = opportunityFactory.create(getAlertType(), cycle, snapshot, baseline, unusual);
        return Optional.of(opportunityFactory.score(opportunity));
    }
}
