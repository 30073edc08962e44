package com.ryuqq.monobuild.core.config;

/**
 * 커맨드 라인 설정 오류.
 *
 * <p>중복 이름, 잘못된 페이즈 이름, 존재하지 않는 페이즈/커맨드 참조, 의존성 순환,
 * build/rebuild 제약 위반, 파라미터 연결 오류 등 사용자가 수정해야 하는 오류를 나타냅니다.
 * 설정 로드 시점에 즉시 발생하며, 이 예외가 발생하면 스케줄링으로 진행하지 않습니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 문제가 된 이름을 포함한 오류 메시지
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
