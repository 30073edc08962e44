package com.ryuqq.monobuild.testkit.runner;

import com.ryuqq.monobuild.application.graph.OperationRunnerFactory;
import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.project.Project;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link com.ryuqq.monobuild.application.graph.OperationRunnerFactory} backed by scripted runners.
 *
 * <p>Operations without a registered runner succeed immediately. Every created runner is
 * remembered so tests can check how often it ran.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ScriptedOperationRunnerFactory implements OperationRunnerFactory {

    private final Map<String, ScriptedOperationRunner> scripted = new HashMap<>();
    private final Map<String, ScriptedOperationRunner> created = new ConcurrentHashMap<>();
    private ConcurrencyProbe probe;

    /**
     * Registers the runner for an operation id such as {@code "app (_phase:build)"}.
     *
     * @param operationId operation id value
     * @param runner runner to use
     * @return this factory
     */
    public ScriptedOperationRunnerFactory script(String operationId, ScriptedOperationRunner runner) {
        scripted.put(operationId, runner);
        return this;
    }

    /**
     * Attaches a probe to every default runner.
     *
     * @param probe concurrency probe
     * @return this factory
     */
    public ScriptedOperationRunnerFactory withProbe(ConcurrencyProbe probe) {
        this.probe = probe;
        return this;
    }

    @Override
    public OperationRunner createPhaseRunner(PhasedCommand command, Phase phase, Project project) {
        return create(OperationId.forPhase(phase, project).getValue());
    }

    @Override
    public OperationRunner createGlobalRunner(GlobalCommand command) {
        return create(command.getName());
    }

    private OperationRunner create(String operationId) {
        ScriptedOperationRunner runner = scripted.get(operationId);
        if (runner == null) {
            runner = ScriptedOperationRunner.succeeding(operationId);
            if (probe != null) {
                runner = runner.withProbe(probe);
            }
        }
        created.put(operationId, runner);
        return runner;
    }

    /**
     * Runner created for an operation.
     *
     * @param operationId operation id value
     * @return the runner, or null if none was created
     */
    public ScriptedOperationRunner runnerFor(String operationId) {
        return created.get(operationId);
    }
}
