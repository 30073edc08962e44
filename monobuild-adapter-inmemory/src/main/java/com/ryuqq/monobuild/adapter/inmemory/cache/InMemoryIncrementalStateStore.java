package com.ryuqq.monobuild.adapter.inmemory.cache;

import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.spi.IncrementalStateStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IncrementalStateStore} for testing and reference purposes.
 *
 * <p>State lives as long as the instance. Sharing one instance between executions
 * models a repository whose previous build outputs are still on disk.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public class InMemoryIncrementalStateStore implements IncrementalStateStore {

    private final ConcurrentHashMap<OperationId, String> lastSuccessfulKeys = new ConcurrentHashMap<>();

    @Override
    public Optional<String> lastSuccessfulCacheKey(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return Optional.ofNullable(lastSuccessfulKeys.get(operationId));
    }

    @Override
    public void recordSuccess(OperationId operationId, String cacheKey) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (cacheKey == null || cacheKey.isBlank()) {
            throw new IllegalArgumentException("cacheKey cannot be null or blank");
        }
        lastSuccessfulKeys.put(operationId, cacheKey);
    }

    public int size() {
        return lastSuccessfulKeys.size();
    }

    /**
     * Clears all state (for test isolation).
     */
    public void clear() {
        lastSuccessfulKeys.clear();
    }
}
