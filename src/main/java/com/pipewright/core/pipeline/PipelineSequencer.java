package com.pipewright.core.pipeline;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Answers "what runs after this step" and "may the run chain on its own".
 */
@Service
public class PipelineSequencer {

    private static final Logger log = LoggerFactory.getLogger(PipelineSequencer.class);

    private final PipelineCatalog catalog;

    public PipelineSequencer(PipelineCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @return the step following {@code currentStep} in the template, or null when the
     *         template is unknown, the step is not in it, it is the last step, or either
     *         argument is null or empty
     */
    public Step nextStep(String templateName, String currentStep) {
        if (templateName == null || templateName.isBlank()) {
            return null;
        }
        return nextStep(templateName, Step.fromName(currentStep));
    }

    public Step nextStep(String templateName, Step currentStep) {
        if (templateName == null || templateName.isBlank() || currentStep == null) {
            return null;
        }
        Optional<PipelineTemplate> template = catalog.find(templateName);
        if (template.isEmpty()) {
            log.warn("Unknown pipeline template: {}", templateName);
            return null;
        }
        if (!template.get().contains(currentStep)) {
            log.warn("Step {} not found in template {}", currentStep, templateName);
            return null;
        }
        Step next = template.get().next(currentStep);
        if (next == null) {
            log.info("Step {} is the last step of template {}", currentStep, templateName);
        }
        return next;
    }

    /**
     * True only when the step completed and is not one of the catalog's terminal steps.
     */
    public boolean shouldAutoContinue(String status, String step) {
        return shouldAutoContinue(RunStatus.fromName(status), Step.fromName(step));
    }

    public boolean shouldAutoContinue(RunStatus status, Step step) {
        if (status != RunStatus.COMPLETED || step == null) {
            return false;
        }
        return !catalog.terminalSteps().contains(step);
    }

    /**
     * Template-aware variant: the template's own terminal steps (which always
     * include its last step) also stop chaining.
     */
    public boolean shouldAutoContinue(RunStatus status, Step step, String templateName) {
        if (!shouldAutoContinue(status, step)) {
            return false;
        }
        return catalog.find(templateName)
                .map(template -> !template.isTerminal(step))
                .orElse(false);
    }
}
