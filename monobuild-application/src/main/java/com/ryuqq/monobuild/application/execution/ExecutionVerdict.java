package com.ryuqq.monobuild.application.execution;

/**
 * 커맨드 실행 전체 판정.
 *
 * <p>우선순위: CANCELLED &gt; FAILURE &gt; SUCCESS_WITH_WARNINGS &gt; SUCCESS</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public enum ExecutionVerdict {

    /** 모든 Operation이 경고 없이 끝남 */
    SUCCESS(0),

    /** 실패는 없지만 경고를 허용한 Operation이 있음 */
    SUCCESS_WITH_WARNINGS(0),

    /** 하나 이상의 Operation이 FAILURE */
    FAILURE(1),

    /** 외부 취소 또는 타임아웃으로 중단됨 */
    CANCELLED(130);

    private final int exitCode;

    ExecutionVerdict(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return 종료 코드
     */
    public int exitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
