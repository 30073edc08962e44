package com.ryuqq.monobuild.core.spi;

import com.ryuqq.monobuild.core.operation.OperationId;

import java.util.Optional;

/**
 * Remembers the cache key of the last successful run of each operation.
 *
 * <p>Used for incremental build avoidance: an operation whose current cache key equals
 * the recorded one is reported as SKIPPED without running.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently from worker threads</li>
 *   <li>Only successful runs are recorded</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface IncrementalStateStore {

    /**
     * Looks up the cache key of the last successful run.
     *
     * @param operationId the operation identifier
     * @return the recorded key, or empty if the operation never succeeded
     * @throws IllegalArgumentException if operationId is null
     */
    Optional<String> lastSuccessfulCacheKey(OperationId operationId);

    /**
     * Records a successful run, replacing any previous key.
     *
     * @param operationId the operation identifier
     * @param cacheKey the cache key of the inputs that were built
     * @throws IllegalArgumentException if an argument is null or the key is blank
     */
    void recordSuccess(OperationId operationId, String cacheKey);
}
