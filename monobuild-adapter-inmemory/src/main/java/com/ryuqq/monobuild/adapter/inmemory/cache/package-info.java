/**
 * In-memory build cache and incremental state.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.adapter.inmemory.cache.InMemoryBuildCache} - write-once cache entries</li>
 *   <li>{@link com.ryuqq.monobuild.adapter.inmemory.cache.InMemoryIncrementalStateStore} - last successful key per operation</li>
 * </ul>
 *
 * <p>Both are thread-safe and intended for tests and single-process use.</p>
 *
 * @since 1.0.0
 * @author Monobuild Team
 */
package com.ryuqq.monobuild.adapter.inmemory.cache;
