package com.ryuqq.monobuild.adapter.json;

import com.ryuqq.monobuild.core.config.CommandLineConfiguration;
import com.ryuqq.monobuild.core.config.CommandLineParameter;
import com.ryuqq.monobuild.core.config.ConfigurationException;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandKind;
import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import com.ryuqq.monobuild.core.config.definition.ParameterKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CommandLineJsonLoader 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
class CommandLineJsonLoaderTest {

    private static final String PHASED_CONFIG = """
        {
          // 저장소 공통 페이즈
          "phases": [
            {
              "name": "_phase:compile",
              "dependencies": { "upstream": ["_phase:compile"] },
              "ignoreMissingScript": true
            },
            {
              "name": "_phase:test",
              "dependencies": { "self": ["_phase:compile"] },
              "allowWarningsOnSuccess": true
            },
          ],
          "commands": [
            {
              "commandKind": "phased",
              "name": "test",
              "summary": "Run tests",
              "phases": ["_phase:test"],
              "enableParallelism": true
            },
            {
              "commandKind": "global",
              "name": "prettier",
              "shellCommand": "prettier --write ."
            }
          ],
          "parameters": [
            {
              "parameterKind": "choice",
              "longName": "--locale",
              "associatedCommands": ["prettier", "test"],
              "associatedPhases": ["_phase:test"],
              "alternatives": [
                { "name": "en-us", "description": "US English" },
                { "name": "ko-kr", "description": "Korean" }
              ],
              "defaultValue": "en-us"
            }
          ]
        }
        """;

    @TempDir
    Path tempDir;

    private CommandLineJsonLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CommandLineJsonLoader();
    }

    // ============================================================
    // 1. 파일 없음
    // ============================================================

    @Test
    void 파일이_없으면_기본_build와_rebuild() {
        // when
        CommandLineConfiguration configuration = loader.loadFromFileOrDefault(tempDir.resolve("command-line.json"));

        // then
        PhasedCommand build = configuration.findPhasedCommand("build").orElseThrow();
        PhasedCommand rebuild = configuration.findPhasedCommand("rebuild").orElseThrow();
        assertThat(build.isIncremental()).isTrue();
        assertThat(rebuild.isIncremental()).isFalse();
        assertThat(rebuild.sharesPhasesWith(build)).isTrue();
    }

    @Test
    void tryLoadFromFile은_파일이_없으면_empty() {
        Optional<CommandLineConfiguration> configuration = loader.tryLoadFromFile(tempDir.resolve("missing.json"));

        assertThat(configuration).isEmpty();
    }

    // ============================================================
    // 2. 파싱
    // ============================================================

    @Test
    void 주석과_후행_쉼표를_허용하고_모든_섹션을_해석함() throws IOException {
        // given
        Path file = write(PHASED_CONFIG);

        // when
        CommandLineConfiguration configuration = loader.loadFromFileOrDefault(file);

        // then
        Phase compile = configuration.findPhase("_phase:compile").orElseThrow();
        Phase test = configuration.findPhase("_phase:test").orElseThrow();
        assertThat(compile.isIgnoreMissingScript()).isTrue();
        assertThat(compile.getUpstreamDependencies()).containsExactly(compile);
        assertThat(test.isAllowWarningsOnSuccess()).isTrue();
        assertThat(test.getSelfDependencies()).containsExactly(compile);

        PhasedCommand testCommand = configuration.findPhasedCommand("test").orElseThrow();
        assertThat(testCommand.getSummary()).isEqualTo("Run tests");
        assertThat(testCommand.getPhases()).containsExactlyInAnyOrder(compile, test);

        CommandLineParameter locale = configuration.findParameter("--locale").orElseThrow();
        assertThat(locale.kind()).isEqualTo(ParameterKind.CHOICE);
        assertThat(test.getAssociatedParameters()).containsExactly(locale);
        assertThat(configuration.findCommand("prettier").orElseThrow().getAssociatedParameters())
            .containsExactly(locale);

        assertThat(configuration.getCommands()).containsKeys("build", "rebuild", "test", "prettier");
    }

    @Test
    void tryLoadFromFile은_기본_커맨드를_추가하지_않음() throws IOException {
        // given
        Path file = write(PHASED_CONFIG);

        // when
        CommandLineConfiguration configuration = loader.tryLoadFromFile(file).orElseThrow();

        // then
        assertThat(configuration.getCommands()).containsOnlyKeys("test", "prettier");
    }

    @Test
    void build_선언에는_기본_필드가_병합되고_저장소_필드가_우선함() {
        // given
        String json = """
            {
              "commands": [
                { "commandKind": "bulk", "name": "build", "summary": "Custom build", "enableParallelism": false }
              ]
            }
            """;

        // when
        CommandLineDefinition definition = loader.parse(json);

        // then
        CommandDefinition build = definition.commands().get(0);
        assertThat(build.commandKind()).isEqualTo(CommandKind.BULK);
        assertThat(build.summary()).isEqualTo("Custom build");
        assertThat(build.enableParallelism()).isFalse();
        assertThat(build.incremental()).isTrue();
        assertThat(build.description()).contains("incremental build");
    }

    @Test
    void build_이외의_커맨드에는_병합하지_않음() {
        // given
        String json = """
            { "commands": [ { "commandKind": "bulk", "name": "lint" } ] }
            """;

        // when
        CommandDefinition lint = loader.parse(json).commands().get(0);

        // then
        assertThat(lint.summary()).isNull();
        assertThat(lint.incremental()).isNull();
    }

    @Test
    void 빈_파일은_빈_정의() throws IOException {
        // given
        Path file = write("");

        // when
        CommandLineConfiguration configuration = loader.tryLoadFromFile(file).orElseThrow();

        // then
        assertThat(configuration.getCommands()).isEmpty();
    }

    // ============================================================
    // 3. 오류
    // ============================================================

    @Test
    void 잘못된_JSON은_ConfigurationException() throws IOException {
        // given
        Path file = write("{ \"phases\": [ ");

        // when & then
        assertThatThrownBy(() -> loader.loadFromFileOrDefault(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Failed to load " + file);
    }

    @Test
    void 검증_실패는_ConfigurationException으로_전파됨() throws IOException {
        // given
        Path file = write("""
            { "commands": [ { "commandKind": "global", "name": "build", "shellCommand": "make" } ] }
            """);

        // when & then
        assertThatThrownBy(() -> loader.loadFromFileOrDefault(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("using the command kind \"global\"");
    }

    @Test
    void parse는_잘못된_JSON에_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("not json"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Failed to parse command-line configuration");
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("command-line.json");
        Files.writeString(file, content);
        return file;
    }
}
