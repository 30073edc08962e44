/**
 * Resolved command-line configuration: phases, commands and custom parameters.
 *
 * <p>{@link com.ryuqq.monobuild.core.config.CommandLineConfiguration} validates a raw
 * {@link com.ryuqq.monobuild.core.config.definition.CommandLineDefinition} in three steps
 * ({@link com.ryuqq.monobuild.core.config.PhaseRegistry},
 * {@link com.ryuqq.monobuild.core.config.CommandRegistry},
 * {@link com.ryuqq.monobuild.core.config.ParameterBinder}) and fails fast with a
 * {@link com.ryuqq.monobuild.core.config.ConfigurationException} naming the offending entity.</p>
 *
 * <p>Phases and commands are mutated only while the configuration is being built.
 * Afterwards every accessor returns an unmodifiable view.</p>
 */
package com.ryuqq.monobuild.core.config;
