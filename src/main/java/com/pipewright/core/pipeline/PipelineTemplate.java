package com.pipewright.core.pipeline;

import com.pipewright.core.model.Step;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named, ordered sequence of steps.
 *
 * @param name          template name
 * @param steps         steps in execution order, no duplicates
 * @param terminalSteps steps after which the run stops for an external trigger
 */
public record PipelineTemplate(String name, List<Step> steps, Set<Step> terminalSteps) {

    public PipelineTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Template " + name + " has no steps");
        }
        if (new HashSet<>(steps).size() != steps.size()) {
            throw new IllegalArgumentException("Template " + name + " repeats a step: " + steps);
        }
        steps = List.copyOf(steps);
        terminalSteps = terminalSteps == null ? Set.of() : Set.copyOf(terminalSteps);
    }

    /**
     * Builds a template whose terminal steps are the given candidates that
     * appear in the sequence, plus the last step.
     */
    public static PipelineTemplate of(String name, Set<Step> terminalCandidates, List<Step> steps) {
        Set<Step> terminal = EnumSet.noneOf(Step.class);
        for (Step step : steps) {
            if (terminalCandidates.contains(step)) {
                terminal.add(step);
            }
        }
        if (!steps.isEmpty()) {
            terminal.add(steps.get(steps.size() - 1));
        }
        return new PipelineTemplate(name, steps, terminal);
    }

    public boolean contains(Step step) {
        return steps.contains(step);
    }

    public Step first() {
        return steps.get(0);
    }

    /**
     * @return the step after {@code step}, or null when it is the last or not in the template
     */
    public Step next(Step step) {
        int index = steps.indexOf(step);
        if (index < 0 || index == steps.size() - 1) {
            return null;
        }
        return steps.get(index + 1);
    }

    public boolean isTerminal(Step step) {
        return terminalSteps.contains(step);
    }

    public boolean isLast(Step step) {
        return steps.get(steps.size() - 1) == step;
    }
}
