package com.ryuqq.monobuild.adapter.inmemory.cache;

import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.spi.BuildCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link BuildCache} for testing and reference purposes.
 *
 * <p>Entries record which operation produced them. No files are copied: a restore only
 * reports whether an entry exists.</p>
 *
 * <p><strong>Write-Once Guarantee:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#putIfAbsent} makes the first writer win</li>
 *   <li>Later writes for the same key return {@code false} and keep the original entry</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public class InMemoryBuildCache implements BuildCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBuildCache.class);

    /**
     * Cache key → operation that wrote the entry.
     */
    private final ConcurrentHashMap<String, OperationId> entries = new ConcurrentHashMap<>();
    private final AtomicInteger restoreCount = new AtomicInteger();

    @Override
    public boolean tryRestore(String cacheKey, OperationRunnerContext context) {
        validate(cacheKey, context);
        boolean hit = entries.containsKey(cacheKey);
        if (hit) {
            restoreCount.incrementAndGet();
            log.debug("Cache hit for {} ({})", context.operationId(), cacheKey);
        }
        return hit;
    }

    @Override
    public boolean tryWrite(String cacheKey, OperationRunnerContext context) {
        validate(cacheKey, context);
        return entries.putIfAbsent(cacheKey, context.operationId()) == null;
    }

    /**
     * Looks up the operation that wrote an entry.
     *
     * @param cacheKey the cache key
     * @return the writer, or empty if the key has no entry
     */
    public Optional<OperationId> writerOf(String cacheKey) {
        return Optional.ofNullable(entries.get(cacheKey));
    }

    public int size() {
        return entries.size();
    }

    public int getRestoreCount() {
        return restoreCount.get();
    }

    /**
     * Clears all entries (for test isolation).
     */
    public void clear() {
        entries.clear();
        restoreCount.set(0);
    }

    private static void validate(String cacheKey, OperationRunnerContext context) {
        if (cacheKey == null || cacheKey.isBlank()) {
            throw new IllegalArgumentException("cacheKey cannot be null or blank");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
    }
}
