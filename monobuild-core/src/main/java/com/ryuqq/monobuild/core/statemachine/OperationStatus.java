package com.ryuqq.monobuild.core.statemachine;

/**
 * Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>READY → QUEUED (모든 의존 Operation이 비차단 종료 상태에 도달)</li>
 *   <li>READY → BLOCKED (의존 Operation이 FAILURE 또는 BLOCKED로 종료)</li>
 *   <li>QUEUED → EXECUTING (워커에 배정)</li>
 *   <li>EXECUTING → 모든 종료 상태 (러너가 보고한 결과)</li>
 *   <li><strong>종료 상태에서 나가는 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * READY ──────────────► BLOCKED
 *    │
 *    ▼ (의존성 충족)
 * QUEUED
 *    │
 *    ▼ (워커 배정)
 * EXECUTING
 *    │
 *    ├─► SUCCESS
 *    ├─► SUCCESS_WITH_WARNING
 *    ├─► FAILURE
 *    ├─► BLOCKED
 *    ├─► SKIPPED     (증분 빌드 회피)
 *    ├─► NO_OP       (실행할 스크립트 없음)
 *    └─► FROM_CACHE  (빌드 캐시 복원)
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public enum OperationStatus {

    /**
     * 초기 상태. 의존 Operation이 아직 모두 종료되지 않음.
     */
    READY,

    /**
     * 의존성이 모두 충족되어 워커 배정을 기다리는 중.
     */
    QUEUED,

    /**
     * 러너 실행 중.
     */
    EXECUTING,

    /**
     * 성공.
     */
    SUCCESS,

    /**
     * 경고를 동반한 성공 (페이즈가 경고를 허용한 경우에만).
     */
    SUCCESS_WITH_WARNING,

    /**
     * 실패. 이 Operation에 의존하는 모든 Operation은 BLOCKED가 됨.
     */
    FAILURE,

    /**
     * 의존 Operation의 실패로 실행되지 않음.
     */
    BLOCKED,

    /**
     * 입력이 마지막 성공 실행과 동일하여 실행을 건너뜀.
     */
    SKIPPED,

    /**
     * 실행할 작업이 없음.
     */
    NO_OP,

    /**
     * 빌드 캐시에서 출력물을 복원함.
     */
    FROM_CACHE;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return READY, QUEUED, EXECUTING이 아니면 true
     */
    public boolean isTerminal() {
        return this != READY && this != QUEUED && this != EXECUTING;
    }

    /**
     * 소비자(dependent) Operation의 실행을 막는 종료 상태인지 확인.
     *
     * @return FAILURE 또는 BLOCKED인 경우 true
     */
    public boolean isBlocking() {
        return this == FAILURE || this == BLOCKED;
    }

    /**
     * 소비자 Operation을 실행 가능하게 만드는 종료 상태인지 확인.
     *
     * @return SUCCESS, SUCCESS_WITH_WARNING, SKIPPED, NO_OP, FROM_CACHE인 경우 true
     */
    public boolean isNonBlockingTerminal() {
        return isTerminal() && !isBlocking();
    }
}
