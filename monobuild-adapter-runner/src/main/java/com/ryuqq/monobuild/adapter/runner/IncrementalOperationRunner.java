package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.spi.BuildCache;
import com.ryuqq.monobuild.core.spi.CacheKeyProvider;
import com.ryuqq.monobuild.core.spi.IncrementalStateStore;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * 증분 빌드 회피와 빌드 캐시를 적용하는 runner 데코레이터.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. cacheKey = CacheKeyProvider.computeCacheKey(phase, project)
 *    - empty → delegate 실행 (추적 불가)
 * 2. incremental && skip 허용 && 마지막 성공 키 == cacheKey → SKIPPED
 * 3. 빌드 캐시 사용 && tryRestore(cacheKey)              → FROM_CACHE
 * 4. delegate 실행
 *    - SUCCESS 또는 허용된 SUCCESS_WITH_WARNING → recordSuccess + tryWrite (쓰기 허용 시)
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class IncrementalOperationRunner implements OperationRunner {

    private static final Logger log = LoggerFactory.getLogger(IncrementalOperationRunner.class);

    private final OperationRunner delegate;
    private final CacheKeyProvider cacheKeyProvider;
    private final IncrementalStateStore stateStore;
    private final BuildCache buildCache;
    private final boolean incremental;
    private final boolean warningsAllowed;

    /**
     * 생성자.
     *
     * @param delegate 실제 작업 runner
     * @param cacheKeyProvider 캐시 키 계산기
     * @param stateStore 증분 상태 저장소
     * @param buildCache 빌드 캐시 (null이면 캐시 미사용)
     * @param incremental 커맨드가 증분 빌드인지 여부
     * @param warningsAllowed 페이즈가 경고를 허용하는지 여부
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public IncrementalOperationRunner(OperationRunner delegate, CacheKeyProvider cacheKeyProvider,
                                      IncrementalStateStore stateStore, BuildCache buildCache,
                                      boolean incremental, boolean warningsAllowed) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (cacheKeyProvider == null) {
            throw new IllegalArgumentException("cacheKeyProvider cannot be null");
        }
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        this.delegate = delegate;
        this.cacheKeyProvider = cacheKeyProvider;
        this.stateStore = stateStore;
        this.buildCache = buildCache;
        this.incremental = incremental;
        this.warningsAllowed = warningsAllowed;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public RunOutcome execute(OperationRunnerContext context) throws IOException, InterruptedException {
        if (context.phase() == null || context.project() == null) {
            return delegate.execute(context);
        }

        Optional<String> cacheKey = cacheKeyProvider.computeCacheKey(context.phase(), context.project());
        if (cacheKey.isEmpty()) {
            log.debug("{} has no cache key, running without build avoidance", context.operationId());
            return delegate.execute(context);
        }
        String key = cacheKey.get();

        if (incremental && delegate.isSkipAllowed()
            && stateStore.lastSuccessfulCacheKey(context.operationId()).filter(key::equals).isPresent()) {
            log.debug("{} is up to date", context.operationId());
            return RunOutcome.of(OperationStatus.SKIPPED);
        }

        if (buildCache != null && buildCache.tryRestore(key, context)) {
            stateStore.recordSuccess(context.operationId(), key);
            log.debug("{} restored from build cache", context.operationId());
            return RunOutcome.of(OperationStatus.FROM_CACHE);
        }

        RunOutcome outcome = delegate.execute(context);
        if (isCacheable(outcome.status())) {
            stateStore.recordSuccess(context.operationId(), key);
            if (buildCache != null && delegate.isCacheWriteAllowed() && !buildCache.tryWrite(key, context)) {
                log.debug("Build cache already had an entry for {}", context.operationId());
            }
        }
        return outcome;
    }

    private boolean isCacheable(OperationStatus status) {
        return status == OperationStatus.SUCCESS
            || (status == OperationStatus.SUCCESS_WITH_WARNING && (warningsAllowed || delegate.warningsAreAllowed()));
    }

    @Override
    public boolean isSkipAllowed() {
        return delegate.isSkipAllowed();
    }

    @Override
    public boolean isCacheWriteAllowed() {
        return delegate.isCacheWriteAllowed();
    }

    @Override
    public boolean warningsAreAllowed() {
        return delegate.warningsAreAllowed();
    }

    @Override
    public boolean reportTiming() {
        return delegate.reportTiming();
    }

    @Override
    public boolean isSilent() {
        return delegate.isSilent();
    }
}
