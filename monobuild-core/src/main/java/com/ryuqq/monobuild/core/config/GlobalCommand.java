package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandKind;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 저장소 루트에서 한 번 실행되는 커맨드.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class GlobalCommand implements Command {

    private final String name;
    private final String summary;
    private final String description;
    private final boolean safeForSimultaneousProcesses;
    private final String shellCommand;
    private final Set<CommandLineParameter> associatedParameters = new LinkedHashSet<>();

    GlobalCommand(String name, String summary, String description,
                  boolean safeForSimultaneousProcesses, String shellCommand) {
        this.name = name;
        this.summary = summary;
        this.description = description;
        this.safeForSimultaneousProcesses = safeForSimultaneousProcesses;
        this.shellCommand = shellCommand;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CommandKind getKind() {
        return CommandKind.GLOBAL;
    }

    @Override
    public String getSummary() {
        return summary;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean isSafeForSimultaneousProcesses() {
        return safeForSimultaneousProcesses;
    }

    /**
     * 실행할 셸 명령.
     *
     * @return 셸 명령 또는 null
     */
    public String getShellCommand() {
        return shellCommand;
    }

    @Override
    public Set<CommandLineParameter> getAssociatedParameters() {
        return Collections.unmodifiableSet(associatedParameters);
    }

    void addAssociatedParameter(CommandLineParameter parameter) {
        associatedParameters.add(parameter);
    }

    @Override
    public String toString() {
        return "GlobalCommand{" + name + '}';
    }
}
