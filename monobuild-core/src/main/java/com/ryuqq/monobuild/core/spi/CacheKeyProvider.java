package com.ryuqq.monobuild.core.spi;

import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.project.Project;

import java.io.IOException;
import java.util.Optional;

/**
 * Computes the content-hash cache key of one (phase, project) operation.
 *
 * <p>The key must change whenever any input of the operation changes (source files,
 * dependency outputs, the script text, parameter values). How inputs are hashed is
 * left to the implementation.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface CacheKeyProvider {

    /**
     * Computes the cache key.
     *
     * @param phase the phase being run
     * @param project the project being built
     * @return the cache key, or empty if the inputs cannot be tracked (disables skip and cache)
     * @throws IOException if reading the inputs fails
     */
    Optional<String> computeCacheKey(Phase phase, Project project) throws IOException;
}
