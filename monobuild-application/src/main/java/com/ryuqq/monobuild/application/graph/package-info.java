/**
 * Operation Graph - 커맨드 실행 한 번의 작업 DAG 생성.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.application.graph.OperationGraphBuilder} - 페이즈 × 프로젝트 교차곱과 간선 연결</li>
 *   <li>{@link com.ryuqq.monobuild.application.graph.OperationRunnerFactory} - Operation별 runner 생성 포트</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
package com.ryuqq.monobuild.application.graph;
