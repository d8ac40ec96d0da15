package com.codemend.core.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What executing a plan did: the files it changed and the status of each step.
 */
public final class PlanExecutionReport {

    private final Set<String>      affectedPaths;
    private final List<StepReport> steps;

    public PlanExecutionReport(Set<String> affectedPaths, List<StepReport> steps) {
        this.affectedPaths = Collections.unmodifiableSet(new LinkedHashSet<>(affectedPaths));
        this.steps         = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public Set<String>      getAffectedPaths() { return affectedPaths; }
    public List<StepReport> getSteps()         { return steps; }

    /** True when no step completed: every step was skipped or had nothing to do. */
    public boolean isNoOp() {
        return steps.stream().noneMatch(s -> s.getStatus() == StepStatus.COMPLETED);
    }

    public long countWithStatus(StepStatus status) {
        return steps.stream().filter(s -> s.getStatus() == status).count();
    }

    @Override
    public String toString() {
        return "PlanExecutionReport{affected=" + affectedPaths + ", steps=" + steps + "}";
    }
}
