package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.spi.ProcessLauncher;
import com.ryuqq.monobuild.core.spi.ProcessResult;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

/**
 * ShellOperationRunner 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ShellOperationRunnerTest {

    private static final Path FOLDER = Path.of("packages/app");
    private static final OperationRunnerContext CONTEXT =
        new OperationRunnerContext(OperationId.of("app (build)"), null, null, () -> false);

    @Mock
    private ProcessLauncher processLauncher;

    @Test
    void 종료_코드_0이면_SUCCESS() throws Exception {
        // given
        given(processLauncher.launch("tsc", FOLDER, Map.of("CI", "1")))
            .willReturn(new ProcessResult(0, "done", ""));
        ShellOperationRunner runner = new ShellOperationRunner("app (build)", "tsc", FOLDER, Map.of("CI", "1"), processLauncher);

        // when
        RunOutcome outcome = runner.execute(CONTEXT);

        // then
        assertThat(outcome.status()).isEqualTo(OperationStatus.SUCCESS);
        assertThat(outcome.output()).isEqualTo("done");
        verify(processLauncher).launch("tsc", FOLDER, Map.of("CI", "1"));
    }

    @Test
    void 종료_코드가_0이_아니면_FAILURE() throws Exception {
        // given
        given(processLauncher.launch("tsc", FOLDER, Map.of()))
            .willReturn(new ProcessResult(2, "", "error TS2304"));
        ShellOperationRunner runner = new ShellOperationRunner("app (build)", "tsc", FOLDER, null, processLauncher);

        // when
        RunOutcome outcome = runner.execute(CONTEXT);

        // then
        assertThat(outcome.status()).isEqualTo(OperationStatus.FAILURE);
        assertThat(outcome.output()).contains("error TS2304");
    }

    @Test
    void stderr_출력이_있으면_SUCCESS_WITH_WARNING() throws Exception {
        // given
        given(processLauncher.launch("tsc", FOLDER, Map.of()))
            .willReturn(new ProcessResult(0, "ok", "deprecated option"));
        ShellOperationRunner runner = new ShellOperationRunner("app (build)", "tsc", FOLDER, Map.of(), processLauncher);

        // when
        RunOutcome outcome = runner.execute(CONTEXT);

        // then
        assertThat(outcome.status()).isEqualTo(OperationStatus.SUCCESS_WITH_WARNING);
        assertThat(outcome.output()).isEqualTo("okdeprecated option");
    }

    @Test
    void 빈_명령은_거부됨() {
        assertThatThrownBy(() -> new ShellOperationRunner("app (build)", " ", FOLDER, Map.of(), processLauncher))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
