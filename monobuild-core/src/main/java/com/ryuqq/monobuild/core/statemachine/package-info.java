/**
 * Operation status state machine package.
 *
 * <p>This package implements the status transition rules for the Operation lifecycle
 * during one execution pass.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.core.statemachine.OperationStatus} - Operation lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.monobuild.core.statemachine.StatusTransition} - Status transition validation and execution</li>
 * </ul>
 *
 * <h2>Status Transition Rules</h2>
 * <pre>
 * READY → QUEUED (dependencies satisfied)
 * READY → BLOCKED (a dependency failed or was blocked)
 * QUEUED → EXECUTING (dispatched to a worker)
 * EXECUTING → SUCCESS | SUCCESS_WITH_WARNING | FAILURE | BLOCKED | SKIPPED | NO_OP | FROM_CACHE
 *
 * Forbidden:
 * - any terminal status → *
 * - Backward transitions (e.g., EXECUTING → READY)
 * </pre>
 *
 * @since 1.0.0
 * @author Monobuild Team
 */
package com.ryuqq.monobuild.core.statemachine;
