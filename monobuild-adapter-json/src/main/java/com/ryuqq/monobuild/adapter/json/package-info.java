/**
 * Jackson based loader for {@code common/config/rush/command-line.json}.
 *
 * @since 1.0.0
 * @author Monobuild Team
 */
package com.ryuqq.monobuild.adapter.json;
