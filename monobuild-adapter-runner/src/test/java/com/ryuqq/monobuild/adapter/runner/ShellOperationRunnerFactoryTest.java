package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.adapter.inmemory.cache.InMemoryBuildCache;
import com.ryuqq.monobuild.adapter.inmemory.cache.InMemoryIncrementalStateStore;
import com.ryuqq.monobuild.core.config.CommandLineConfiguration;
import com.ryuqq.monobuild.core.config.ConfigurationException;
import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.ParameterValues;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import com.ryuqq.monobuild.core.config.definition.ParameterDefinition;
import com.ryuqq.monobuild.core.config.definition.PhaseDefinition;
import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.project.Project;
import com.ryuqq.monobuild.core.spi.CacheKeyProvider;
import com.ryuqq.monobuild.core.spi.ProcessLauncher;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ShellOperationRunnerFactory 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ShellOperationRunnerFactoryTest {

    private static final Path ROOT = Path.of("/repo");

    @Mock
    private ProcessLauncher processLauncher;

    @Mock
    private CacheKeyProvider cacheKeyProvider;

    private CommandLineConfiguration configuration;

    @BeforeEach
    void setUp() {
        configuration = CommandLineConfiguration.from(new CommandLineDefinition(
            List.of(
                PhaseDefinition.of("_phase:compile"),
                new PhaseDefinition("_phase:lint", null, true, null)
            ),
            List.of(
                CommandDefinition.phased("verify", List.of("_phase:compile", "_phase:lint")),
                CommandDefinition.global("format", "prettier --write .")
            ),
            List.of(
                ParameterDefinition.flag("--production", List.of("verify"), List.of("_phase:compile")),
                ParameterDefinition.flag("--check", List.of("format"), List.of())
            )
        ));
    }

    // ============================================================
    // 1. 페이즈 runner
    // ============================================================

    @Test
    void 스크립트가_있으면_파라미터_인자를_붙인_ShellOperationRunner() {
        // given
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT,
            ParameterValues.of(Map.of("--production", "true")));
        Project app = project(Map.of("_phase:compile", "tsc -p ."));

        // when
        OperationRunner runner = factory.createPhaseRunner(verify(), phase("_phase:compile"), app);

        // then
        assertThat(runner).isInstanceOf(ShellOperationRunner.class);
        ShellOperationRunner shell = (ShellOperationRunner) runner;
        assertThat(shell.getCommandLine()).isEqualTo("tsc -p . --production");
        assertThat(shell.getWorkingDirectory()).isEqualTo(app.folder());
        assertThat(shell.name()).isEqualTo("app (_phase:compile)");
    }

    @Test
    void 스크립트가_없고_ignoreMissingScript면_조용한_NO_OP() {
        // given
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT, ParameterValues.empty());

        // when
        OperationRunner runner = factory.createPhaseRunner(verify(), phase("_phase:lint"), project(Map.of()));

        // then
        assertThat(runner).isInstanceOf(NullOperationRunner.class);
        assertThat(((NullOperationRunner) runner).getResult()).isEqualTo(OperationStatus.NO_OP);
        assertThat(runner.isSilent()).isTrue();
    }

    @Test
    void 스크립트가_없고_ignoreMissingScript가_아니면_예외() {
        // given
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT, ParameterValues.empty());

        // when & then
        assertThatThrownBy(() -> factory.createPhaseRunner(verify(), phase("_phase:compile"), project(Map.of())))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("The project [app] does not define a '_phase:compile' command in the 'scripts' section "
                + "of its package.json");
    }

    @Test
    void 빈_스크립트는_보이는_NO_OP() {
        // given
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT, ParameterValues.empty());

        // when
        OperationRunner runner = factory.createPhaseRunner(verify(), phase("_phase:compile"),
            project(Map.of("_phase:compile", "")));

        // then
        assertThat(runner).isInstanceOf(NullOperationRunner.class);
        assertThat(runner.isSilent()).isFalse();
    }

    @Test
    void BuildCacheSupport가_있으면_IncrementalOperationRunner로_감쌈() {
        // given
        BuildCacheSupport support = new BuildCacheSupport(cacheKeyProvider,
            new InMemoryIncrementalStateStore(), new InMemoryBuildCache());
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT,
            ParameterValues.empty(), Map.of(), support);

        // when
        OperationRunner runner = factory.createPhaseRunner(verify(), phase("_phase:compile"),
            project(Map.of("_phase:compile", "tsc")));

        // then
        assertThat(runner).isInstanceOf(IncrementalOperationRunner.class);
        assertThat(runner.name()).isEqualTo("app (_phase:compile)");
    }

    // ============================================================
    // 2. global runner
    // ============================================================

    @Test
    void global_runner는_저장소_루트에서_실행됨() {
        // given
        ShellOperationRunnerFactory factory = new ShellOperationRunnerFactory(processLauncher, ROOT,
            ParameterValues.of(Map.of("--check", "true")));
        GlobalCommand format = (GlobalCommand) configuration.findCommand("format").orElseThrow();

        // when
        ShellOperationRunner runner = (ShellOperationRunner) factory.createGlobalRunner(format);

        // then
        assertThat(runner.getCommandLine()).isEqualTo("prettier --write . --check");
        assertThat(runner.getWorkingDirectory()).isEqualTo(ROOT);
    }

    @Test
    void appendArguments는_인자가_없으면_스크립트를_그대로_반환() {
        assertThat(ShellOperationRunnerFactory.appendArguments("tsc", List.of())).isEqualTo("tsc");
        assertThat(ShellOperationRunnerFactory.appendArguments("tsc", List.of("--a", "b"))).isEqualTo("tsc --a b");
    }

    private PhasedCommand verify() {
        return configuration.findPhasedCommand("verify").orElseThrow();
    }

    private Phase phase(String name) {
        return configuration.findPhase(name).orElseThrow();
    }

    private static Project project(Map<String, String> scripts) {
        return new Project("app", Path.of("/repo/apps/app"), scripts, Set.of());
    }
}
