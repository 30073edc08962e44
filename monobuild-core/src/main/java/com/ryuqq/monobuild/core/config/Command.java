package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandKind;

import java.util.Set;

/**
 * 해석된 커맨드.
 *
 * <p>bulk 커맨드는 로드 시 phased 커맨드로 변환되므로 해석된 커맨드는 두 종류뿐입니다:</p>
 * <ul>
 *   <li>{@link GlobalCommand}: 프로젝트 그래프와 무관하게 한 번 실행</li>
 *   <li>{@link PhasedCommand}: 페이즈 × 프로젝트 Operation 그래프로 실행</li>
 * </ul>
 *
 * <p><strong>Pattern Matching 예시:</strong></p>
 * <pre>
 * if (command instanceof PhasedCommand phased) {
 *     graph = builder.build(phased, projectGraph, selection);
 * } else if (command instanceof GlobalCommand global) {
 *     graph = builder.buildGlobal(global);
 * }
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public sealed interface Command permits GlobalCommand, PhasedCommand {

    /**
     * 커맨드 이름.
     *
     * @return 이름
     */
    String getName();

    /**
     * 해석된 커맨드 종류.
     *
     * @return GLOBAL 또는 PHASED
     */
    CommandKind getKind();

    /**
     * 한 줄 요약.
     *
     * @return 요약 또는 null
     */
    String getSummary();

    /**
     * 상세 설명.
     *
     * @return 설명 또는 null
     */
    String getDescription();

    /**
     * 여러 프로세스가 동시에 실행해도 안전한지 여부.
     *
     * @return 안전하면 true
     */
    boolean isSafeForSimultaneousProcesses();

    /**
     * 이 커맨드와 연결된 커스텀 파라미터 (읽기 전용 뷰).
     *
     * @return 파라미터 집합
     */
    Set<CommandLineParameter> getAssociatedParameters();
}
