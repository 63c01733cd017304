package com.mouse.scanner.interfaces;

import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.ScoreResult;

import java.util.Optional;

public interface OpportunityScorer {

    /**
     * @return the score, or empty when the scorer has no opinion on this opportunity
     */
    Optional<ScoreResult> score(Opportunity opportunity);
}
