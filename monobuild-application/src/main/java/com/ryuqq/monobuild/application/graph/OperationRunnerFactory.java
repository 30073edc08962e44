package com.ryuqq.monobuild.application.graph;

import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.project.Project;

/**
 * Operation별 runner 생성 포트.
 *
 * <p>그래프 빌더는 runner가 무엇을 하는지 알지 못하며, (커맨드, 페이즈, 프로젝트) 조합마다
 * 이 팩토리에 runner 생성을 위임합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface OperationRunnerFactory {

    /**
     * (페이즈, 프로젝트) Operation의 runner 생성.
     *
     * @param command 실행 중인 phased 커맨드
     * @param phase 페이즈
     * @param project 프로젝트
     * @return runner
     * @throws com.ryuqq.monobuild.core.config.ConfigurationException 프로젝트에 필요한 스크립트가 없는 경우
     */
    OperationRunner createPhaseRunner(PhasedCommand command, Phase phase, Project project);

    /**
     * global 커맨드 Operation의 runner 생성.
     *
     * @param command global 커맨드
     * @return runner
     */
    OperationRunner createGlobalRunner(GlobalCommand command);
}
