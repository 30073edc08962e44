package com.ryuqq.monobuild.core.spi;

import com.ryuqq.monobuild.core.operation.OperationRunnerContext;

import java.io.IOException;

/**
 * Build output cache (local folder or remote store).
 *
 * <p>Reads may run concurrently. Each cache key is written at most once: a second
 * {@link #tryWrite} for a key that already has an entry must return {@code false}
 * and leave the existing entry untouched.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface BuildCache {

    /**
     * Restores the outputs recorded under the key into the project folder.
     *
     * @param cacheKey the cache key
     * @param context the operation being run
     * @return {@code true} if an entry existed and was restored
     * @throws IOException if restoring fails
     */
    boolean tryRestore(String cacheKey, OperationRunnerContext context) throws IOException;

    /**
     * Stores the outputs of a successful run under the key.
     *
     * @param cacheKey the cache key
     * @param context the operation that produced the outputs
     * @return {@code true} if a new entry was written, {@code false} if the key already had one
     * @throws IOException if writing fails
     */
    boolean tryWrite(String cacheKey, OperationRunnerContext context) throws IOException;
}
