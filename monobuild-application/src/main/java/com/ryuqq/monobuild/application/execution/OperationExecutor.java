package com.ryuqq.monobuild.application.execution;

import com.ryuqq.monobuild.application.graph.OperationGraph;

/**
 * Operation DAG 실행 포트.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>Operation은 모든 의존성이 non-blocking terminal 상태가 된 뒤에만 실행됩니다</li>
 *   <li>의존성 중 하나라도 FAILURE/BLOCKED면 runner를 실행하지 않고 BLOCKED로 기록합니다</li>
 *   <li>개별 Operation 실패는 예외가 아니라 결과의 verdict로 전달됩니다</li>
 *   <li>취소되면 새 Operation을 시작하지 않고, 실행 중인 작업을 기다린 뒤 CANCELLED를 반환합니다</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface OperationExecutor {

    /**
     * 그래프 실행.
     *
     * @param graph 실행할 Operation DAG (실행 중 상태가 변경됨)
     * @param cancellationSignal 취소 신호
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null이거나 그래프가 이미 실행된 경우
     */
    ExecutionResult execute(OperationGraph graph, CancellationSignal cancellationSignal);

    /**
     * 취소 없이 그래프 실행.
     *
     * @param graph 실행할 Operation DAG
     * @return 실행 결과
     */
    default ExecutionResult execute(OperationGraph graph) {
        return execute(graph, new CancellationSignal());
    }
}
