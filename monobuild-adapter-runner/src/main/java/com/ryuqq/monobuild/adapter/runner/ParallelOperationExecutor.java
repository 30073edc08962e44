package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.application.execution.CancellationSignal;
import com.ryuqq.monobuild.application.execution.ExecutionResult;
import com.ryuqq.monobuild.application.execution.ExecutionVerdict;
import com.ryuqq.monobuild.application.execution.OperationExecutor;
import com.ryuqq.monobuild.application.execution.OperationRecord;
import com.ryuqq.monobuild.application.graph.OperationGraph;
import com.ryuqq.monobuild.core.operation.Operation;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 제한된 동시성으로 Operation DAG를 위상 순서대로 실행하는 executor.
 *
 * <p><strong>실행 모델 (Kahn 알고리즘 + 워커 풀):</strong></p>
 * <pre>
 * 1. 의존성이 없는 Operation → QUEUED, ready 큐에 추가
 * 2. 조정 루프:
 *    a. ready 큐에서 concurrency 한도까지 EXECUTING으로 전환 후 워커에 제출
 *    b. completion 큐에서 결과 하나를 대기 (이벤트 기반, 폴링 없음)
 *    c. 결과 반영:
 *       - non-blocking terminal → consumers의 남은 의존성 수 감소, 0이면 QUEUED
 *       - FAILURE/BLOCKED      → 전이적 consumers 전체를 BLOCKED로 기록 (runner 미실행)
 * 3. 취소/타임아웃 → 새 dispatch 중단, 실행 중인 워커 인터럽트, 남은 워커 완료 대기
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Operation 상태와 간선은 조정 루프(execute 호출 스레드)만 변경합니다</li>
 *   <li>워커는 결과를 completion 큐로만 전달합니다</li>
 *   <li>워커 풀은 execute 호출마다 생성되고 반환 전에 종료됩니다</li>
 * </ul>
 *
 * <p><strong>판정:</strong> CANCELLED &gt; FAILURE &gt; SUCCESS_WITH_WARNINGS &gt; SUCCESS. FAILURE 판정은 FAILURE 기록이 있을 때만 내립니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ParallelOperationExecutor implements OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelOperationExecutor.class);

    private final ExecutorConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public ParallelOperationExecutor() {
        this(new ExecutorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ParallelOperationExecutor(ExecutorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public ExecutionResult execute(OperationGraph graph, CancellationSignal cancellationSignal) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (cancellationSignal == null) {
            throw new IllegalArgumentException("cancellationSignal cannot be null");
        }
        for (Operation operation : graph.getOperations()) {
            if (operation.getStatus() != OperationStatus.READY) {
                throw new IllegalArgumentException(
                    "Operation graph was already executed: " + operation.getId() + " is " + operation.getStatus()
                );
            }
        }

        long startNanos = System.nanoTime();
        if (graph.isEmpty()) {
            log.info("No operations to execute for \"{}\"", graph.getCommandName());
            return new ExecutionResult(ExecutionVerdict.SUCCESS, List.of(), Duration.ZERO);
        }

        int concurrency = graph.isParallelismAllowed() ? Math.min(config.concurrency(), graph.size()) : 1;
        log.info("Executing {} operations for \"{}\" (concurrency: {})",
            graph.size(), graph.getCommandName(), concurrency);

        Run run = new Run(graph, cancellationSignal, concurrency, startNanos);
        return run.execute();
    }

    /**
     * execute 호출 하나의 실행 상태.
     */
    private final class Run {

        private final OperationGraph graph;
        private final CancellationSignal signal;
        private final int concurrency;
        private final long startNanos;
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final Map<Operation, Thread> runningThreads = new ConcurrentHashMap<>();
        private final Map<Operation, Integer> pendingDependencies = new HashMap<>();
        private final Deque<Operation> ready = new ArrayDeque<>();
        private final List<OperationRecord> records = new ArrayList<>();
        private final Runnable cancelListener = this::onCancel;
        private int inFlight;
        private boolean failureSeen;
        private boolean warningSeen;
        private boolean aborted;

        Run(OperationGraph graph, CancellationSignal signal, int concurrency, long startNanos) {
            this.graph = graph;
            this.signal = signal;
            this.concurrency = concurrency;
            this.startNanos = startNanos;
        }

        ExecutionResult execute() {
            for (Operation operation : graph.getOperations()) {
                int dependencies = operation.getDependencies().size();
                pendingDependencies.put(operation, dependencies);
                if (dependencies == 0) {
                    enqueue(operation);
                }
            }

            ExecutorService workers = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
            signal.onCancel(cancelListener);
            try {
                coordinate(workers);
            } finally {
                signal.removeListener(cancelListener);
                workers.shutdownNow();
            }

            return buildResult();
        }

        private void coordinate(ExecutorService workers) {
            Long deadlineNanos = config.timeout() == null ? null : startNanos + config.timeout().toNanos();

            while (true) {
                while (!isDispatchStopped() && inFlight < concurrency && !ready.isEmpty()) {
                    dispatch(ready.poll(), workers);
                }
                if (inFlight == 0) {
                    break;
                }

                Completion completion;
                try {
                    completion = awaitCompletion(deadlineNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    signal.cancel("Executor thread was interrupted");
                    drainAfterInterrupt(workers);
                    return;
                }

                if (completion == null) {
                    signal.cancel("Timed out after " + config.timeout().toMillis() + " ms");
                    deadlineNanos = null;
                } else if (completion.operation() != null) {
                    complete(completion);
                }
            }

            if (!isDispatchStopped() && hasUnfinishedOperations()) {
                throw new IllegalStateException(
                    "Operation graph for \"" + graph.getCommandName() + "\" contains a dependency cycle"
                );
            }
        }

        private Completion awaitCompletion(Long deadlineNanos) throws InterruptedException {
            if (deadlineNanos == null || signal.isCancelled()) {
                return completions.take();
            }
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            return completions.poll(remaining, TimeUnit.NANOSECONDS);
        }

        private void drainAfterInterrupt(ExecutorService workers) {
            workers.shutdownNow();
            Completion completion;
            while ((completion = completions.poll()) != null) {
                if (completion.operation() != null) {
                    complete(completion);
                }
            }
        }

        private boolean isDispatchStopped() {
            return signal.isCancelled() || aborted;
        }

        private void enqueue(Operation operation) {
            operation.transitionTo(OperationStatus.QUEUED);
            ready.add(operation);
        }

        private void dispatch(Operation operation, ExecutorService workers) {
            operation.transitionTo(OperationStatus.EXECUTING);
            inFlight++;
            log.debug("Starting {}", operation.getId());

            OperationRunnerContext context = new OperationRunnerContext(
                operation.getId(), operation.getPhase(), operation.getProject(), signal::isCancelled);
            workers.execute(() -> runWorker(operation, context));
        }

        /**
         * 워커 스레드에서 runner 실행. 결과는 항상 completion 큐로 전달됩니다.
         */
        private void runWorker(Operation operation, OperationRunnerContext context) {
            long workerStart = System.nanoTime();
            runningThreads.put(operation, Thread.currentThread());
            RunOutcome outcome = null;
            Exception error = null;
            try {
                if (signal.isCancelled()) {
                    outcome = RunOutcome.failure("cancelled before start");
                } else {
                    outcome = operation.getRunner().execute(context);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = RunOutcome.failure("interrupted");
            } catch (Exception e) {
                error = e;
                outcome = RunOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
            } finally {
                runningThreads.remove(operation);
                if (outcome == null) {
                    outcome = RunOutcome.failure("runner terminated abnormally");
                }
                Duration duration = Duration.ofNanos(System.nanoTime() - workerStart);
                completions.add(new Completion(operation, outcome, duration, error));
            }
        }

        private void complete(Completion completion) {
            inFlight--;
            Operation operation = completion.operation();
            RunOutcome outcome = completion.outcome();
            OperationStatus status = outcome.status();

            if (completion.error() != null) {
                log.error("Runner \"{}\" failed for {}", operation.getRunner().name(), operation.getId(), completion.error());
            }
            if (status == OperationStatus.SUCCESS_WITH_WARNING && !operation.isWarningsAllowed()) {
                log.warn("{} produced warnings which are not allowed for this phase", operation.getId());
                status = OperationStatus.FAILURE;
            }

            operation.transitionTo(status);
            records.add(new OperationRecord(operation.getId(), status, completion.duration(), outcome.output()));
            logCompletion(operation, status, completion.duration());

            switch (status) {
                case FAILURE -> {
                    failureSeen = true;
                    blockConsumers(operation);
                    if (config.abortOnFirstFailure() && !aborted) {
                        aborted = true;
                        log.warn("Aborting after first failure: {}", operation.getId());
                    }
                }
                // BLOCKED는 consumer만 차단하고 판정에는 반영하지 않음
                case BLOCKED -> blockConsumers(operation);
                default -> {
                    if (status == OperationStatus.SUCCESS_WITH_WARNING) {
                        warningSeen = true;
                    }
                    releaseConsumers(operation);
                }
            }
        }

        private void releaseConsumers(Operation operation) {
            for (Operation consumer : operation.getConsumers()) {
                int remaining = pendingDependencies.merge(consumer, -1, Integer::sum);
                if (remaining == 0 && consumer.getStatus() == OperationStatus.READY) {
                    enqueue(consumer);
                }
            }
        }

        private void blockConsumers(Operation failed) {
            Deque<Operation> worklist = new ArrayDeque<>(failed.getConsumers());
            while (!worklist.isEmpty()) {
                Operation consumer = worklist.poll();
                if (consumer.getStatus() != OperationStatus.READY) {
                    continue;
                }
                consumer.transitionTo(OperationStatus.BLOCKED);
                records.add(new OperationRecord(consumer.getId(), OperationStatus.BLOCKED, Duration.ZERO, ""));
                log.warn("{} blocked by {}", consumer.getId(), failed.getId());
                worklist.addAll(consumer.getConsumers());
            }
        }

        private void logCompletion(Operation operation, OperationStatus status, Duration duration) {
            if (operation.getRunner().isSilent()) {
                log.debug("{} finished: {}", operation.getId(), status);
            } else if (operation.getRunner().reportTiming()) {
                log.info("{} finished: {} ({} ms)", operation.getId(), status, duration.toMillis());
            } else {
                log.info("{} finished: {}", operation.getId(), status);
            }
        }

        private boolean hasUnfinishedOperations() {
            for (Operation operation : graph.getOperations()) {
                if (!operation.getStatus().isTerminal()) {
                    return true;
                }
            }
            return false;
        }

        private void onCancel() {
            completions.add(Completion.WAKE_UP);
            for (Thread thread : runningThreads.values()) {
                thread.interrupt();
            }
        }

        private ExecutionResult buildResult() {
            for (Operation operation : graph.getOperations()) {
                if (!operation.getStatus().isTerminal()) {
                    records.add(new OperationRecord(operation.getId(), operation.getStatus(), Duration.ZERO, ""));
                }
            }

            ExecutionVerdict verdict;
            if (signal.isCancelled()) {
                verdict = ExecutionVerdict.CANCELLED;
            } else if (failureSeen) {
                verdict = ExecutionVerdict.FAILURE;
            } else if (warningSeen) {
                verdict = ExecutionVerdict.SUCCESS_WITH_WARNINGS;
            } else {
                verdict = ExecutionVerdict.SUCCESS;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (verdict == ExecutionVerdict.CANCELLED) {
                log.warn("Execution of \"{}\" cancelled ({}) after {} ms",
                    graph.getCommandName(), signal.getReason(), elapsed.toMillis());
            } else {
                log.info("Execution of \"{}\" finished: {} in {} ms",
                    graph.getCommandName(), verdict, elapsed.toMillis());
            }
            return new ExecutionResult(verdict, records, elapsed);
        }
    }

    /**
     * 워커 → 조정 루프 결과 전달. operation이 null이면 취소 알림.
     */
    private record Completion(Operation operation, RunOutcome outcome, Duration duration, Exception error) {

        private static final Completion WAKE_UP = new Completion(null, null, Duration.ZERO, null);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "monobuild-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
