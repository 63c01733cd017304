package com.mouse.scanner.service;

import com.mouse.scanner.entity.BacktestResult;
import com.mouse.scanner.entity.Opportunity;
import com.mouse.scanner.model.OpportunityFilter;
import com.mouse.scanner.repository.BacktestResultRepository;
import com.mouse.scanner.repository.OpportunityRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistence of opportunities and their backtest results.
 * Opportunities are append-only; results are keyed by opportunity id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpportunityService {

    private final OpportunityRepository opportunityRepository;
    private final BacktestResultRepository backtestResultRepository;
    private final Clock clock;

    /**
     * @return generated id
     * @throws IllegalStateException when the opportunity was already saved
     */
    @Transactional
    public Long save(Opportunity opportunity) {
        if (opportunity.getId() != null) {
            throw new IllegalStateException("Opportunity " + opportunity.getId() + " is already persisted");
        }
        opportunity.setPersistedAt(clock.instant());
        Opportunity saved = opportunityRepository.save(opportunity);
        if (saved != opportunity) {
            opportunity.setId(saved.getId());
        }
        log.debug("Saved opportunity id={} {}", saved.getId(), saved.dedupKey());
        return saved.getId();
    }

    @Transactional
    public BacktestResult saveResult(BacktestResult result) {
        if (result.getOpportunity() == null || result.getOpportunity().getId() == null) {
            throw new IllegalArgumentException("Backtest result must reference a persisted opportunity");
        }
        return backtestResultRepository.save(result);
    }

    @Transactional(readOnly = true)
    public List<Opportunity> query(OpportunityFilter filter) {
        return opportunityRepository.findAll(toSpecification(filter),
                Sort.by(Sort.Order.desc("detectedAt"), Sort.Order.desc("id")));
    }

    /**
     * Opportunities without a result that were detected at or before {@code maturedBefore}.
     */
    @Transactional(readOnly = true)
    public List<Opportunity> findAwaitingBacktest(Instant maturedBefore) {
        return opportunityRepository.findAwaitingBacktest(maturedBefore);
    }

    @Transactional(readOnly = true)
    public List<BacktestResult> findResults(Instant since) {
        if (since == null) {
            return backtestResultRepository.findAll();
        }
        return backtestResultRepository.findByOpportunity_DetectedAtGreaterThanEqual(since);
    }

    static Specification<Opportunity> toSpecification(OpportunityFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter != null) {
                if (filter.getSymbol() != null && !filter.getSymbol().isBlank()) {
                    predicates.add(cb.equal(root.get("symbol"), filter.getSymbol().trim().toUpperCase()));
                }
                if (filter.getAlertType() != null && !filter.getAlertType().isBlank()) {
                    predicates.add(cb.equal(root.get("alertType"), filter.getAlertType().trim()));
                }
                if (filter.getFrom() != null) {
                    predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("detectedAt"), filter.getFrom()));
                }
                if (filter.getTo() != null) {
                    predicates.add(cb.lessThan(root.<Instant>get("detectedAt"), filter.getTo()));
                }
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
