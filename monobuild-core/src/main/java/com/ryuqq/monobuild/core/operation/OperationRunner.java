package com.ryuqq.monobuild.core.operation;

import java.io.IOException;

/**
 * Operation 하나의 실제 작업을 수행하는 능력.
 *
 * <p>Executor는 runner가 프로세스를 어떻게 실행하는지, 해시를 어떻게 계산하는지 알지 못하며
 * 반환된 {@link RunOutcome}의 상태만 사용합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>워커 스레드에서 호출되므로 Operation 그래프를 수정하지 않아야 합니다</li>
 *   <li>인터럽트되면 {@link InterruptedException}을 던지거나 인터럽트 상태를 유지해야 합니다</li>
 *   <li>반환 상태는 terminal이어야 하며, BLOCKED는 executor만 결정합니다</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface OperationRunner {

    /**
     * 로그 출력용 이름.
     *
     * @return runner 이름
     */
    String name();

    /**
     * 작업 실행.
     *
     * @param context 실행 컨텍스트
     * @return 실행 결과
     * @throws IOException 프로세스 실행 또는 캐시 I/O 실패 시
     * @throws InterruptedException 취소로 인터럽트된 경우
     */
    RunOutcome execute(OperationRunnerContext context) throws IOException, InterruptedException;

    /**
     * 증분 빌드 회피(SKIPPED) 허용 여부.
     *
     * @return 기본값 true
     */
    default boolean isSkipAllowed() {
        return true;
    }

    /**
     * 성공 시 빌드 캐시 기록 허용 여부.
     *
     * @return 기본값 true
     */
    default boolean isCacheWriteAllowed() {
        return true;
    }

    /**
     * 페이즈 설정과 무관하게 경고를 허용하는지 여부.
     *
     * @return 기본값 false
     */
    default boolean warningsAreAllowed() {
        return false;
    }

    /**
     * 요약 출력에 실행 시간을 보고할지 여부.
     *
     * @return 기본값 true
     */
    default boolean reportTiming() {
        return true;
    }

    /**
     * 요약 출력에서 숨길지 여부.
     *
     * @return 기본값 false
     */
    default boolean isSilent() {
        return false;
    }
}
