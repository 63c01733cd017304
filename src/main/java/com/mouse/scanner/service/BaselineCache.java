package com.mouse.scanner.service;

import com.mouse.scanner.model.BaselineVolume;
import com.mouse.scanner.model.ContractKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Baselines computed during one scan cycle. A new instance is created per cycle and dropped with it.
 * <p>
 * Concurrent callers asking for the same contract share one computation: the first caller runs the
 * loader, the others wait on its future, so each contract is fetched at most once per cycle.
 */
@Slf4j
public class BaselineCache {

    private final Map<ContractKey, CompletableFuture<BaselineVolume>> entries = new ConcurrentHashMap<>();
    private final Function<ContractKey, BaselineVolume> loader;
    private final AtomicInteger loads = new AtomicInteger();

    public BaselineCache(Function<ContractKey, BaselineVolume> loader) {
        this.loader = loader;
    }

    public BaselineVolume get(ContractKey contract) {
        CompletableFuture<BaselineVolume> created = new CompletableFuture<>();
        CompletableFuture<BaselineVolume> existing = entries.putIfAbsent(contract, created);
        if (existing != null) {
            return existing.join();
        }

        loads.incrementAndGet();
        try {
            BaselineVolume baseline = loader.apply(contract);
            created.complete(baseline != null ? baseline : BaselineVolume.UNKNOWN);
        } catch (RuntimeException e) {
            log.warn("Baseline load failed for {}: {}", contract, e.toString());
            created.complete(BaselineVolume.UNKNOWN);
        } finally {
            // no-op once completed; releases waiters when the loader threw an Error
            created.complete(BaselineVolume.UNKNOWN);
        }
        return created.join();
    }

    public int size() {
        return entries.size();
    }

    /** Number of loader invocations, one per distinct contract. */
    public int getLoadCount() {
        return loads.get();
    }
}
