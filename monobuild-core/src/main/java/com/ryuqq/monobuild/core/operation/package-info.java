/**
 * Operation 모델 - 커맨드 실행 한 번의 작업 단위.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.core.operation.Operation} - DAG 노드 (상태, 의존성, consumers)</li>
 *   <li>{@link com.ryuqq.monobuild.core.operation.OperationRunner} - 실제 작업 수행</li>
 *   <li>{@link com.ryuqq.monobuild.core.operation.RunOutcome} - runner가 보고하는 terminal 상태</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
package com.ryuqq.monobuild.core.operation;
