package com.mouse.scanner.entity;

import com.mouse.scanner.enums.OptionType;
import com.mouse.scanner.model.ContractKey;
import com.mouse.scanner.model.ScoreResult;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A detected anomaly on a single option contract.
 * <p>
 * Created by a detector, enriched with an optional score, then persisted once. After it has an id the
 * record is final: scores can no longer be attached and the service never updates it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(
        name = "opportunity",
        indexes = {
                @Index(name = "idx_opportunity_symbol", columnList = "symbol"),
                @Index(name = "idx_opportunity_alert_type", columnList = "alertType"),
                @Index(name = "idx_opportunity_detected_at", columnList = "detectedAt")
        }
)
@ToString
public class Opportunity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Contract identity
    @Column(length = 16, nullable = false)
    private String symbol;

    @Column(length = 64)
    private String optionSymbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 8, nullable = false)
    private OptionType optionType;

    private double strike;

    @Column(nullable = false)
    private LocalDate expiration;

    @Column(nullable = false)
    private Instant detectedAt;

    // Market facts at detection
    private double price;
    private long volume;
    private long openInterest;
    private double notionalValue;
    private double underlyingPrice;
    private Double impliedVolatility;

    // Derived from the baseline; both null when the baseline was unknown
    private Double baselineAverageVolume;
    private Double volumeRatio;

    @Column(length = 32, nullable = false)
    private String alertType;

    private boolean unusualVolume;

    // Optional score from the scoring collaborator
    private Double successProbability;

    @Column(length = 24)
    private String scoreConfidence;

    @Column(columnDefinition = "TEXT")
    private String scoreReasoning;

    private Instant persistedAt;

    public ContractKey contractKey() {
        return new ContractKey(symbol, optionType, strike, expiration);
    }

    /**
     * Key used to suppress repeat alerts: contract identity plus alert type, without the timestamp.
     */
    public String dedupKey() {
        return alertType + "|" + contractKey();
    }

    public boolean isScored() {
        return successProbability != null;
    }

    public void attachScore(ScoreResult score) {
        if (id != null) {
            throw new IllegalStateException("Opportunity " + id + " is already persisted");
        }
        this.successProbability = Math.max(0.0, Math.min(100.0, score.getSuccessProbability()));
        this.scoreConfidence = score.getConfidence();
        this.scoreReasoning = score.getReasoning();
    }
}
