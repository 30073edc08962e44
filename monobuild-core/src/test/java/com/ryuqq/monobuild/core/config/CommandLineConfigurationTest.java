package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import com.ryuqq.monobuild.core.config.definition.ParameterDefinition;
import com.ryuqq.monobuild.core.config.definition.PhaseDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ryuqq.monobuild.core.config.PhaseRegistryTest.phase;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * CommandLineConfiguration 통합 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
class CommandLineConfigurationTest {

    @Test
    void 빈_정의는_기본_build와_rebuild만_가짐() {
        // when
        CommandLineConfiguration configuration = CommandLineConfiguration.from(CommandLineDefinition.empty());

        // then
        assertThat(configuration.getCommands()).containsOnlyKeys("build", "rebuild");
        assertThat(configuration.getPhases()).containsOnlyKeys("build");
        assertThat(configuration.findSyntheticPhase("build")).isPresent();
        assertThat(configuration.getParameters()).isEmpty();
    }

    @Test
    void 기본_커맨드_제외_옵션이면_커맨드가_없음() {
        CommandLineConfiguration configuration = CommandLineConfiguration.from(
            CommandLineDefinition.empty(), CommandLineConfigurationOptions.withoutDefaultBuildCommands());

        assertThat(configuration.getCommands()).isEmpty();
        assertThat(configuration.getPhases()).isEmpty();
    }

    @Test
    void 페이즈_커맨드_파라미터가_순서대로_해석됨() {
        // given
        CommandLineDefinition definition = new CommandLineDefinition(
            List.of(
                phase("_phase:compile", List.of(), List.of("_phase:compile")),
                phase("_phase:test", List.of("_phase:compile"), List.of())
            ),
            List.of(
                CommandDefinition.phased("build", List.of("_phase:compile")),
                CommandDefinition.phased("test", List.of("_phase:test"))
            ),
            List.of(ParameterDefinition.flag("--production", List.of("build", "test"), List.of("_phase:compile")))
        );

        // when
        CommandLineConfiguration configuration = CommandLineConfiguration.from(definition);

        // then
        PhasedCommand test = configuration.findPhasedCommand("test").orElseThrow();
        assertThat(test.getPhases()).extracting(Phase::getName)
            .containsExactlyInAnyOrder("_phase:test", "_phase:compile");

        PhasedCommand rebuild = configuration.findPhasedCommand("rebuild").orElseThrow();
        PhasedCommand build = configuration.findPhasedCommand("build").orElseThrow();
        assertThat(rebuild.sharesPhasesWith(build)).isTrue();

        CommandLineParameter production = configuration.findParameter("--production").orElseThrow();
        assertThat(rebuild.getAssociatedParameters()).contains(production);
        assertThat(configuration.findPhase("_phase:compile").orElseThrow().getAssociatedParameters())
            .containsExactly(production);
    }

    @Test
    void global_커맨드는_findPhasedCommand로_조회되지_않음() {
        CommandLineDefinition definition = new CommandLineDefinition(
            List.of(), List.of(CommandDefinition.global("deploy", "./deploy.sh")), List.of());

        CommandLineConfiguration configuration = CommandLineConfiguration.from(definition);

        assertThat(configuration.findCommand("deploy")).isPresent();
        assertThat(configuration.findPhasedCommand("deploy")).isEmpty();
    }

    @Test
    void 페이즈가_없는_phased_커맨드는_빈_phases를_가짐() {
        CommandLineDefinition definition = new CommandLineDefinition(
            List.of(PhaseDefinition.of("_phase:a")),
            List.of(CommandDefinition.phased("noop", List.of())),
            List.of());

        CommandLineConfiguration configuration = CommandLineConfiguration.from(definition);

        assertThat(configuration.findPhasedCommand("noop").orElseThrow().getPhases()).isEmpty();
    }
}
