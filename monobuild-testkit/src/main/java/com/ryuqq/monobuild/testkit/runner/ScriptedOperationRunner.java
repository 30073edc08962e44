package com.ryuqq.monobuild.testkit.runner;

import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test runner returning a preconfigured outcome.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedOperationRunner runner = ScriptedOperationRunner.returning("lib", OperationStatus.FAILURE)
 *     .withDelay(Duration.ofMillis(50))
 *     .withProbe(probe);
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ScriptedOperationRunner implements OperationRunner {

    private final String name;
    private final OperationStatus status;
    private final Duration delay;
    private final ConcurrencyProbe probe;
    private final RuntimeException failure;
    private final AtomicInteger invocations = new AtomicInteger();

    private ScriptedOperationRunner(String name, OperationStatus status, Duration delay,
                                    ConcurrencyProbe probe, RuntimeException failure) {
        this.name = name;
        this.status = status;
        this.delay = delay;
        this.probe = probe;
        this.failure = failure;
    }

    public static ScriptedOperationRunner returning(String name, OperationStatus status) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        return new ScriptedOperationRunner(name, status, Duration.ZERO, null, null);
    }

    public static ScriptedOperationRunner succeeding(String name) {
        return returning(name, OperationStatus.SUCCESS);
    }

    /**
     * Runner that throws instead of returning.
     *
     * @param name runner name
     * @param failure exception to throw
     * @return runner
     */
    public static ScriptedOperationRunner throwing(String name, RuntimeException failure) {
        return new ScriptedOperationRunner(name, OperationStatus.FAILURE, Duration.ZERO, null, failure);
    }

    public ScriptedOperationRunner withDelay(Duration delay) {
        return new ScriptedOperationRunner(name, status, delay, probe, failure);
    }

    public ScriptedOperationRunner withProbe(ConcurrencyProbe probe) {
        return new ScriptedOperationRunner(name, status, delay, probe, failure);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RunOutcome execute(OperationRunnerContext context) throws IOException, InterruptedException {
        invocations.incrementAndGet();
        if (probe != null) {
            probe.enter();
        }
        try {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            if (failure != null) {
                throw failure;
            }
            return new RunOutcome(status, name + " → " + status);
        } finally {
            if (probe != null) {
                probe.exit();
            }
        }
    }

    /**
     * Number of times {@link #execute} was called.
     *
     * @return invocation count
     */
    public int getInvocations() {
        return invocations.get();
    }
}
