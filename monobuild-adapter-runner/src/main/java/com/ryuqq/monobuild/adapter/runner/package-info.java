/**
 * Runner Adapter Layer - OperationExecutor와 runner 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.monobuild.adapter.runner.ParallelOperationExecutor} - 제한된 동시성의 위상 순서 실행기</li>
 *   <li>{@link com.ryuqq.monobuild.adapter.runner.ShellOperationRunnerFactory} - 프로젝트 스크립트 runner 생성</li>
 *   <li>{@link com.ryuqq.monobuild.adapter.runner.IncrementalOperationRunner} - 증분 빌드 회피 / 빌드 캐시</li>
 *   <li>{@link com.ryuqq.monobuild.adapter.runner.LocalProcessLauncher} - 로컬 셸 프로세스 실행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ParallelOperationExecutor, ShellOperationRunnerFactory)
 *   ↓ implements
 * application (OperationExecutor, OperationRunnerFactory)
 *   ↓ depends on
 * core (Phase, PhasedCommand, Operation, OperationStatus, spi)
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
package com.ryuqq.monobuild.adapter.runner;
