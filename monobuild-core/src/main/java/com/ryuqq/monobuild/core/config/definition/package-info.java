/**
 * Raw command-line declarations.
 *
 * <p>Records in this package mirror the structure of {@code command-line.json} after
 * structural (schema) validation and before semantic validation. Names are not yet
 * resolved to objects; {@link com.ryuqq.monobuild.core.config.CommandLineConfiguration}
 * turns them into a validated, cross-referenced model.</p>
 *
 * @since 1.0.0
 * @author Monobuild Team
 */
package com.ryuqq.monobuild.core.config.definition;
