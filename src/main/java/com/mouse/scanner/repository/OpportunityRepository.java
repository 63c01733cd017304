package com.mouse.scanner.repository;

import com.mouse.scanner.entity.Opportunity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OpportunityRepository extends JpaRepository<Opportunity, Long>, JpaSpecificationExecutor<Opportunity> {

    // Opportunities detected at or before the cutoff that have no backtest result yet
    @Query(value = """
    SELECT o FROM Opportunity o
    WHERE o.detectedAt <= :cutoff
      AND NOT EXISTS (SELECT r FROM BacktestResult r WHERE r.opportunityId = o.id)
    ORDER BY o.detectedAt ASC, o.id ASC
    """)
    List<Opportunity> findAwaitingBacktest(@Param("cutoff") Instant cutoff);
}
