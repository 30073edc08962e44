package com.ryuqq.monobuild.application.graph;

import com.ryuqq.monobuild.core.operation.Operation;
import com.ryuqq.monobuild.core.operation.OperationId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 한 번의 커맨드 실행을 위한 Operation DAG.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class OperationGraph {

    private final String commandName;
    private final Map<OperationId, Operation> operations;
    private final boolean parallelismAllowed;

    OperationGraph(String commandName, Map<OperationId, Operation> operations, boolean parallelismAllowed) {
        this.commandName = commandName;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.parallelismAllowed = parallelismAllowed;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * 생성 순서대로의 Operation 목록.
     *
     * @return 읽기 전용 컬렉션
     */
    public Collection<Operation> getOperations() {
        return operations.values();
    }

    public Optional<Operation> find(OperationId id) {
        return Optional.ofNullable(operations.get(id));
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * false면 executor는 설정과 무관하게 동시성 1로 실행합니다.
     *
     * @return 병렬 실행 허용 여부
     */
    public boolean isParallelismAllowed() {
        return parallelismAllowed;
    }

    @Override
    public String toString() {
        return "OperationGraph{" + commandName + ", operations=" + operations.size() + '}';
    }
}
