package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.application.execution.CancellationSignal;
import com.ryuqq.monobuild.application.execution.ExecutionResult;
import com.ryuqq.monobuild.application.execution.ExecutionVerdict;
import com.ryuqq.monobuild.application.execution.OperationRecord;
import com.ryuqq.monobuild.application.graph.OperationGraph;
import com.ryuqq.monobuild.application.graph.OperationGraphBuilder;
import com.ryuqq.monobuild.core.config.CommandLineConfiguration;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandKind;
import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import com.ryuqq.monobuild.core.project.Project;
import com.ryuqq.monobuild.core.project.ProjectGraph;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import com.ryuqq.monobuild.testkit.runner.ConcurrencyProbe;
import com.ryuqq.monobuild.testkit.runner.ScriptedOperationRunner;
import com.ryuqq.monobuild.testkit.runner.ScriptedOperationRunnerFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParallelOperationExecutor 테스트.
 *
 * <p>기본 build 커맨드(합성 페이즈 "build", upstream 자기 의존)로 그래프를 만들고
 * ScriptedOperationRunnerFactory로 각 Operation의 결과를 지정합니다.</p>
 *
 * <ul>
 *   <li>의존성 순서와 Blocked 전파</li>
 *   <li>동시성 한도</li>
 *   <li>비차단 종료 상태 (SKIPPED, FROM_CACHE, NO_OP)</li>
 *   <li>경고 승격</li>
 *   <li>취소, 타임아웃, 첫 실패 중단</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@Timeout(30)
class ParallelOperationExecutorTest {

    private CommandLineConfiguration configuration;
    private ScriptedOperationRunnerFactory runnerFactory;

    @BeforeEach
    void setUp() {
        configuration = CommandLineConfiguration.from(CommandLineDefinition.empty());
        runnerFactory = new ScriptedOperationRunnerFactory();
    }

    // ============================================================
    // 1. 의존성 순서
    // ============================================================

    @Test
    void 체인의_모든_Operation이_의존성_순서대로_성공함() {
        // given: c → b → a
        ProjectGraph projects = chain("a", "b", "c");
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(4)).execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.SUCCESS);
        assertThat(result.exitCode()).isZero();
        assertThat(result.records()).extracting(record -> record.operationId().getValue())
            .containsExactly("a (build)", "b (build)", "c (build)");
        assertThat(graph.getOperations()).allMatch(operation -> operation.getStatus() == OperationStatus.SUCCESS);
    }

    @Test
    void 실패한_Operation의_전이적_consumer는_BLOCKED이고_runner는_실행되지_않음() {
        // given: c → b → a, d (독립)
        Project a = project("a");
        Project b = project("b", "a");
        Project c = project("c", "b");
        Project d = project("d");
        ProjectGraph projects = ProjectGraph.of(List.of(a, b, c, d));
        runnerFactory.script("a (build)", ScriptedOperationRunner.returning("a", OperationStatus.FAILURE));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(2)).execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.FAILURE);
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.failures()).extracting(record -> record.operationId().getValue())
            .containsExactly("a (build)");
        assertThat(result.blocked()).extracting(record -> record.operationId().getValue())
            .containsExactlyInAnyOrder("b (build)", "c (build)");
        assertThat(result.find("d (build)").orElseThrow().status()).isEqualTo(OperationStatus.SUCCESS);
        assertThat(runnerFactory.runnerFor("b (build)").getInvocations()).isZero();
        assertThat(runnerFactory.runnerFor("c (build)").getInvocations()).isZero();
    }

    @Test
    void runner가_BLOCKED를_반환하면_consumer는_차단되지만_판정은_FAILURE가_아님() {
        // given
        ProjectGraph projects = chain("a", "b");
        runnerFactory.script("a (build)", ScriptedOperationRunner.returning("a", OperationStatus.BLOCKED));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.SUCCESS);
        assertThat(result.failures()).isEmpty();
        assertThat(result.countOf(OperationStatus.BLOCKED)).isEqualTo(2);
        assertThat(runnerFactory.runnerFor("b (build)").getInvocations()).isZero();
    }

    @Test
    void 비차단_종료_상태는_consumer를_실행_가능하게_함() {
        // given: d → c → b → a
        ProjectGraph projects = chain("a", "b", "c", "d");
        runnerFactory
            .script("a (build)", ScriptedOperationRunner.returning("a", OperationStatus.SKIPPED))
            .script("b (build)", ScriptedOperationRunner.returning("b", OperationStatus.FROM_CACHE))
            .script("c (build)", ScriptedOperationRunner.returning("c", OperationStatus.NO_OP));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.SUCCESS);
        assertThat(result.find("d (build)").orElseThrow().status()).isEqualTo(OperationStatus.SUCCESS);
        assertThat(result.countOf(OperationStatus.SKIPPED)).isEqualTo(1);
        assertThat(result.countOf(OperationStatus.FROM_CACHE)).isEqualTo(1);
        assertThat(result.countOf(OperationStatus.NO_OP)).isEqualTo(1);
    }

    @Test
    void 다이아몬드_consumer는_모든_의존성이_끝난_뒤_한_번만_실행됨() {
        // given: top → left, right → base
        Project base = project("base");
        Project left = project("left", "base");
        Project right = project("right", "base");
        Project top = project("top", "left", "right");
        ProjectGraph projects = ProjectGraph.of(List.of(base, left, right, top));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(3)).execute(graph);

        // then
        List<String> order = new ArrayList<>();
        for (OperationRecord record : result.records()) {
            order.add(record.operationId().getValue());
        }
        assertThat(order.get(0)).isEqualTo("base (build)");
        assertThat(order.get(3)).isEqualTo("top (build)");
        assertThat(runnerFactory.runnerFor("top (build)").getInvocations()).isEqualTo(1);
    }

    // ============================================================
    // 2. 동시성 한도
    // ============================================================

    @Test
    void concurrency_1이면_동시에_하나만_실행됨() {
        // given
        ConcurrencyProbe probe = new ConcurrencyProbe();
        ProjectGraph projects = independent(5);
        scriptAll(projects, probe, Duration.ofMillis(20));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(1)).execute(graph);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(probe.getMax()).isEqualTo(1);
    }

    @Test
    void concurrency_N을_넘어서_실행하지_않음() {
        // given
        ConcurrencyProbe probe = new ConcurrencyProbe();
        ProjectGraph projects = independent(8);
        scriptAll(projects, probe, Duration.ofMillis(30));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(3)).execute(graph);

        // then
        assertThat(result.countOf(OperationStatus.SUCCESS)).isEqualTo(8);
        assertThat(probe.getMax()).isBetween(1, 3);
        assertThat(probe.getCurrent()).isZero();
    }

    @Test
    void enableParallelism이_false면_concurrency와_무관하게_직렬_실행() {
        // given
        configuration = CommandLineConfiguration.from(new CommandLineDefinition(List.of(),
            List.of(CommandDefinition.bulk("build").withEnableParallelism(false)), List.of()));
        ConcurrencyProbe probe = new ConcurrencyProbe();
        ProjectGraph projects = independent(4);
        scriptAll(projects, probe, Duration.ofMillis(20));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(new ExecutorConfig().withConcurrency(4)).execute(graph);

        // then
        assertThat(graph.isParallelismAllowed()).isFalse();
        assertThat(result.isSuccess()).isTrue();
        assertThat(probe.getMax()).isEqualTo(1);
    }

    // ============================================================
    // 3. 경고와 예외
    // ============================================================

    @Test
    void 경고가_허용되지_않으면_FAILURE로_승격됨() {
        // given
        ProjectGraph projects = chain("a", "b");
        runnerFactory.script("a (build)",
            ScriptedOperationRunner.returning("a", OperationStatus.SUCCESS_WITH_WARNING));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.FAILURE);
        assertThat(result.find("a (build)").orElseThrow().status()).isEqualTo(OperationStatus.FAILURE);
        assertThat(result.find("b (build)").orElseThrow().status()).isEqualTo(OperationStatus.BLOCKED);
    }

    @Test
    void 경고가_허용되면_SUCCESS_WITH_WARNINGS_판정() {
        // given
        CommandDefinition build = new CommandDefinition(CommandKind.BULK, "build", null, null, null, null,
            null, null, null, null, true, null, null, null, null);
        configuration = CommandLineConfiguration.from(new CommandLineDefinition(List.of(), List.of(build), List.of()));
        ProjectGraph projects = chain("a", "b");
        runnerFactory.script("a (build)",
            ScriptedOperationRunner.returning("a", OperationStatus.SUCCESS_WITH_WARNING));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.SUCCESS_WITH_WARNINGS);
        assertThat(result.exitCode()).isZero();
        assertThat(result.find("b (build)").orElseThrow().status()).isEqualTo(OperationStatus.SUCCESS);
    }

    @Test
    void runner_예외는_FAILURE로_기록됨() {
        // given
        ProjectGraph projects = independent(1);
        runnerFactory.script("p0 (build)",
            ScriptedOperationRunner.throwing("p0", new IllegalStateException("compiler crashed")));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        // then
        OperationRecord record = result.find("p0 (build)").orElseThrow();
        assertThat(record.status()).isEqualTo(OperationStatus.FAILURE);
        assertThat(record.output()).contains("compiler crashed");
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.FAILURE);
    }

    // ============================================================
    // 4. 취소, 타임아웃, 중단
    // ============================================================

    @Test
    void 실행_중_취소되면_CANCELLED이고_남은_Operation은_실행되지_않음() throws Exception {
        // given
        ProjectGraph projects = chain("a", "b");
        runnerFactory.script("a (build)",
            ScriptedOperationRunner.succeeding("a").withDelay(Duration.ofSeconds(10)));
        OperationGraph graph = buildGraph(projects);
        CancellationSignal signal = new CancellationSignal();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel("SIGINT");
        });

        // when
        canceller.start();
        ExecutionResult result = new ParallelOperationExecutor().execute(graph, signal);
        canceller.join();

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.CANCELLED);
        assertThat(result.exitCode()).isEqualTo(130);
        assertThat(result.elapsed()).isLessThan(Duration.ofSeconds(10));
        assertThat(runnerFactory.runnerFor("b (build)").getInvocations()).isZero();
    }

    @Test
    void 시작_전에_취소된_신호면_아무것도_실행하지_않음() {
        // given
        ProjectGraph projects = independent(3);
        OperationGraph graph = buildGraph(projects);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("SIGTERM");

        // when
        ExecutionResult result = new ParallelOperationExecutor().execute(graph, signal);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.CANCELLED);
        assertThat(result.records()).hasSize(3);
        assertThat(result.countOf(OperationStatus.QUEUED)).isEqualTo(3);
        assertThat(runnerFactory.runnerFor("p0 (build)").getInvocations()).isZero();
    }

    @Test
    void 타임아웃이_지나면_CANCELLED() {
        // given
        ProjectGraph projects = independent(1);
        runnerFactory.script("p0 (build)",
            ScriptedOperationRunner.succeeding("p0").withDelay(Duration.ofSeconds(10)));
        OperationGraph graph = buildGraph(projects);
        CancellationSignal signal = new CancellationSignal();

        // when
        ExecutionResult result = new ParallelOperationExecutor(
            new ExecutorConfig().withTimeout(Duration.ofMillis(100))).execute(graph, signal);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.CANCELLED);
        assertThat(signal.getReason()).startsWith("Timed out after 100 ms");
        assertThat(result.find("p0 (build)").orElseThrow().status()).isEqualTo(OperationStatus.FAILURE);
    }

    @Test
    void abortOnFirstFailure면_새_Operation을_시작하지_않음() {
        // given
        ProjectGraph projects = independent(3);
        runnerFactory.script("p0 (build)", ScriptedOperationRunner.returning("p0", OperationStatus.FAILURE));
        OperationGraph graph = buildGraph(projects);

        // when
        ExecutionResult result = new ParallelOperationExecutor(
            new ExecutorConfig().withConcurrency(1).withAbortOnFirstFailure(true)).execute(graph);

        // then
        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.FAILURE);
        assertThat(result.countOf(OperationStatus.QUEUED)).isEqualTo(2);
        assertThat(runnerFactory.runnerFor("p1 (build)").getInvocations()).isZero();
        assertThat(runnerFactory.runnerFor("p2 (build)").getInvocations()).isZero();
    }

    // ============================================================
    // 5. 입력 검증
    // ============================================================

    @Test
    void 이미_실행된_그래프는_거부됨() {
        // given
        OperationGraph graph = buildGraph(independent(1));
        ParallelOperationExecutor executor = new ParallelOperationExecutor();
        executor.execute(graph);

        // when & then
        assertThatThrownBy(() -> executor.execute(graph))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already executed");
    }

    @Test
    void 빈_그래프는_즉시_SUCCESS() {
        OperationGraph graph = buildGraph(ProjectGraph.of(List.of()));

        ExecutionResult result = new ParallelOperationExecutor().execute(graph);

        assertThat(result.verdict()).isEqualTo(ExecutionVerdict.SUCCESS);
        assertThat(result.records()).isEmpty();
    }

    // ============================================================
    // 헬퍼
    // ============================================================

    private OperationGraph buildGraph(ProjectGraph projects) {
        PhasedCommand build = configuration.findPhasedCommand("build").orElseThrow();
        return new OperationGraphBuilder(runnerFactory).build(build, projects, projects.projects());
    }

    private void scriptAll(ProjectGraph projects, ConcurrencyProbe probe, Duration delay) {
        for (Project project : projects.projects()) {
            runnerFactory.script(project.name() + " (build)",
                ScriptedOperationRunner.succeeding(project.name()).withDelay(delay).withProbe(probe));
        }
    }

    private static ProjectGraph chain(String... names) {
        List<Project> projects = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            projects.add(i == 0 ? project(names[i]) : project(names[i], names[i - 1]));
        }
        return ProjectGraph.of(projects);
    }

    private static ProjectGraph independent(int count) {
        List<Project> projects = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            projects.add(project("p" + i));
        }
        return ProjectGraph.of(projects);
    }

    private static Project project(String name, String... dependencies) {
        return new Project(name, Path.of("packages", name), Map.of("build", "echo " + name), Set.of(dependencies));
    }
}
