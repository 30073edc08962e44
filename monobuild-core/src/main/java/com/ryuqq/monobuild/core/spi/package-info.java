/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the build core consumes but does not implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.core.spi.CacheKeyProvider} - content hash of an operation's inputs</li>
 *   <li>{@link com.ryuqq.monobuild.core.spi.IncrementalStateStore} - last successful cache key per operation</li>
 *   <li>{@link com.ryuqq.monobuild.core.spi.BuildCache} - output restore/write, at most one write per key</li>
 *   <li>{@link com.ryuqq.monobuild.core.spi.ProcessLauncher} - external process spawning</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (monobuild-adapter-inmemory, monobuild-adapter-runner) provide
 * concrete implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author Monobuild Team
 */
package com.ryuqq.monobuild.core.spi;
