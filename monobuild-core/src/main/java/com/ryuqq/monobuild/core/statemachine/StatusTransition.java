package com.ryuqq.monobuild.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Operation의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>READY → QUEUED, READY → BLOCKED</li>
 *   <li>QUEUED → EXECUTING</li>
 *   <li>EXECUTING → 모든 종료 상태</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: EXECUTING → READY)</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationStatus from, OperationStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case READY -> to == OperationStatus.QUEUED || to == OperationStatus.BLOCKED;
            case QUEUED -> to == OperationStatus.EXECUTING;
            case EXECUTING -> to.isTerminal();
            default -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OperationStatus transition(OperationStatus current, OperationStatus next) {
        validate(current, next);
        return next;
    }
}
