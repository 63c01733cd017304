package com.mouse.scanner.entity;

import com.mouse.scanner.enums.PriceBasis;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Realized returns of one opportunity at the configured forward horizons.
 * <p>
 * A horizon is missing from {@link #horizonReturns} when the historical data did not reach that far past
 * detection. It is never stored as zero.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "backtest_result")
@ToString(exclude = "opportunity")
public class BacktestResult {

    @Id
    private Long opportunityId;

    @MapsId
    @OneToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "opportunity_id")
    private Opportunity opportunity;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private PriceBasis priceBasis;

    private double entryPrice;

    @Column(nullable = false)
    private Instant evaluatedAt;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "backtest_horizon_return", joinColumns = @JoinColumn(name = "opportunity_id"))
    @MapKeyColumn(name = "horizon", length = 8)
    @Column(name = "return_pct")
    private Map<String, Double> horizonReturns = new LinkedHashMap<>();

    public Optional<Double> returnAt(String horizonLabel) {
        return Optional.ofNullable(horizonReturns.get(horizonLabel));
    }

    public String getAlertType() {
        return opportunity != null ? opportunity.getAlertType() : null;
    }

    public Instant getDetectedAt() {
        return opportunity != null ? opportunity.getDetectedAt() : null;
    }
}
