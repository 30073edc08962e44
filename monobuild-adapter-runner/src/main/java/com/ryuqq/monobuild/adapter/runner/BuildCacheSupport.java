package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.spi.BuildCache;
import com.ryuqq.monobuild.core.spi.CacheKeyProvider;
import com.ryuqq.monobuild.core.spi.IncrementalStateStore;

/**
 * 증분 빌드 회피 및 빌드 캐시 협력자 묶음.
 *
 * @param cacheKeyProvider 캐시 키 계산기
 * @param stateStore 증분 상태 저장소
 * @param buildCache 빌드 캐시 (null이면 캐시 없이 증분 회피만 사용)
 * @author Monobuild Team
 * @since 1.0.0
 */
public record BuildCacheSupport(
    CacheKeyProvider cacheKeyProvider,
    IncrementalStateStore stateStore,
    BuildCache buildCache
) {

    public BuildCacheSupport {
        if (cacheKeyProvider == null) {
            throw new IllegalArgumentException("cacheKeyProvider cannot be null");
        }
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
    }
}
