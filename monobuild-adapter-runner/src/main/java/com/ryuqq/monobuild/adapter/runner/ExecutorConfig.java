package com.ryuqq.monobuild.adapter.runner;

import java.time.Duration;

/**
 * ParallelOperationExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 Operation 최대 수 (기본: CPU 코어 수)</li>
 *   <li>timeout: 전체 실행 제한 시간 (기본: 없음, null)</li>
 *   <li>abortOnFirstFailure: 첫 FAILURE 이후 새 Operation을 시작하지 않음 (기본 false)</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 * @param concurrency 동시 실행 수 (1 이상이어야 함)
 * @param timeout 전체 실행 제한 시간 (null이면 무제한, 아니면 양수여야 함)
 * @param abortOnFirstFailure 첫 실패 시 중단 여부
 */
public record ExecutorConfig(
    int concurrency,
    Duration timeout,
    boolean abortOnFirstFailure
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=CPU 코어 수, timeout=없음, abortOnFirstFailure=false</p>
     */
    public ExecutorConfig() {
        this(Runtime.getRuntime().availableProcessors(), null, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutorConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException(
                "timeout must be positive (current: " + timeout + ")"
            );
        }
    }

    /**
     * --parallelism 값 해석 (현재 머신 코어 수 기준).
     *
     * @param value "max", 정수, 또는 백분율 (예: "50%")
     * @return 동시 실행 수
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static int parseParallelism(String value) {
        return parseParallelism(value, Runtime.getRuntime().availableProcessors());
    }

    /**
     * --parallelism 값 해석.
     *
     * <ul>
     *   <li>"max" → 코어 수</li>
     *   <li>"N%" (1~100) → max(1, floor(코어 수 × N / 100))</li>
     *   <li>정수 N (1 이상) → N</li>
     * </ul>
     *
     * @param value 설정 값
     * @param availableCores 코어 수
     * @return 동시 실행 수
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static int parseParallelism(String value, int availableCores) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("parallelism cannot be null or blank");
        }
        if (availableCores <= 0) {
            throw new IllegalArgumentException("availableCores must be positive (current: " + availableCores + ")");
        }
        String trimmed = value.trim();
        if ("max".equalsIgnoreCase(trimmed)) {
            return availableCores;
        }
        try {
            if (trimmed.endsWith("%")) {
                int percentage = Integer.parseInt(trimmed.substring(0, trimmed.length() - 1).trim());
                if (percentage <= 0 || percentage > 100) {
                    throw new IllegalArgumentException(
                        "Invalid percentage value of '" + value + "', value cannot be less than '1%' or more than '100%'"
                    );
                }
                return Math.max(1, availableCores * percentage / 100);
            }
            int parallelism = Integer.parseInt(trimmed);
            if (parallelism < 1) {
                throw new IllegalArgumentException("Invalid parallelism value of '" + value + "', expected a number greater than 0");
            }
            return parallelism;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid parallelism value of '" + value + "', expected a number, a percentage, or 'max'", e
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withConcurrency(int concurrency) {
        return new ExecutorConfig(concurrency, timeout, abortOnFirstFailure);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withTimeout(Duration timeout) {
        return new ExecutorConfig(concurrency, timeout, abortOnFirstFailure);
    }

    /**
     * abortOnFirstFailure만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withAbortOnFirstFailure(boolean abortOnFirstFailure) {
        return new ExecutorConfig(concurrency, timeout, abortOnFirstFailure);
    }
}
