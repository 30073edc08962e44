/**
 * Execution - Operation Graph 실행 포트와 결과 모델.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.application.execution.OperationExecutor} - 그래프 실행 포트</li>
 *   <li>{@link com.ryuqq.monobuild.application.execution.ExecutionResult} - Operation별 기록과 최종 판정</li>
 *   <li>{@link com.ryuqq.monobuild.application.execution.CancellationSignal} - 실행 중 취소 요청</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
package com.ryuqq.monobuild.application.execution;
