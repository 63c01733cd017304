package com.mouse.scanner.repository;

import com.mouse.scanner.entity.BacktestResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface BacktestResultRepository extends JpaRepository<BacktestResult, Long> {

    List<BacktestResult> findByOpportunity_DetectedAtGreaterThanEqual(Instant since);
}
