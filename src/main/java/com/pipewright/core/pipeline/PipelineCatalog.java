package com.pipewright.core.pipeline;

import com.pipewright.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.pipewright.core.model.Step.*;

/**
 * Registry of pipeline templates.
 * <p>
 * Starts from the standard templates and applies any templates configured under
 * {@code pipewright.pipeline.templates}, which may add new names or replace
 * standard ones. Unknown step names fail startup.
 */
@Component
public class PipelineCatalog {

    private static final Logger log = LoggerFactory.getLogger(PipelineCatalog.class);

    public static final Set<Step> DEFAULT_TERMINAL_STEPS = Collections.unmodifiableSet(EnumSet.of(SHIP, CLEANUP, VERIFY));

    private final Map<String, PipelineTemplate> templates = new LinkedHashMap<>();
    private final Set<Step> terminalSteps;
    private final String defaultTemplate;

    public PipelineCatalog(PipelineProperties properties) {
        List<Step> configuredTerminal = parseSteps("terminal-steps", properties.getTerminalSteps());
        this.terminalSteps = configuredTerminal.isEmpty()
                ? DEFAULT_TERMINAL_STEPS
                : Collections.unmodifiableSet(EnumSet.copyOf(configuredTerminal));
        registerStandardTemplates();
        properties.getTemplates().forEach((name, stepNames) -> {
            List<Step> steps = parseSteps(name, stepNames);
            PipelineTemplate previous = templates.put(name, PipelineTemplate.of(name, terminalSteps, steps));
            log.info("{} template '{}': {}", previous == null ? "Registered" : "Overrode", name, steps);
        });
        this.defaultTemplate = properties.getDefaultTemplate();
        if (!templates.containsKey(defaultTemplate)) {
            throw new IllegalArgumentException("Default template '" + defaultTemplate + "' is not defined");
        }
    }

    /**
     * Catalog with only the standard templates and default terminal steps.
     */
    public static PipelineCatalog standard() {
        return new PipelineCatalog(new PipelineProperties());
    }

    public Optional<PipelineTemplate> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(name));
    }

    public PipelineTemplate require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown template '" + name + "'. Known templates: " + templates.keySet()));
    }

    public Collection<PipelineTemplate> templates() {
        return Collections.unmodifiableCollection(templates.values());
    }

    public Set<Step> terminalSteps() {
        return terminalSteps;
    }

    public String defaultTemplate() {
        return defaultTemplate;
    }

    private void registerStandardTemplates() {
        List<Step> complete = List.of(PLAN, VALIDATE, BUILD, LINT, TEST, REVIEW, DOCUMENT, SHIP, CLEANUP, VERIFY);
        List<Step> sdlc = List.of(PLAN, BUILD, TEST, REVIEW, DOCUMENT, SHIP);

        register("sdlc_complete", complete);
        register("sdlc_complete_zte", complete);
        register("sdlc", sdlc);
        register("sdlc_zte", sdlc);
        register("plan_build", List.of(PLAN, BUILD));
        register("plan_build_test", List.of(PLAN, BUILD, TEST));
        register("plan_build_test_review", List.of(PLAN, BUILD, TEST, REVIEW));
        register("plan_build_document", List.of(PLAN, BUILD, DOCUMENT));
        register("plan_build_review", List.of(PLAN, BUILD, REVIEW));
        register("sdlc_from_build", List.of(BUILD, LINT, TEST, REVIEW, DOCUMENT, SHIP, CLEANUP, VERIFY));
        register("lightweight", List.of(PLAN, BUILD, TEST));
    }

    private void register(String name, List<Step> steps) {
        templates.put(name, PipelineTemplate.of(name, terminalSteps, steps));
    }

    private static List<Step> parseSteps(String owner, List<String> names) {
        var steps = new ArrayList<Step>();
        if (names == null) {
            return steps;
        }
        for (String name : names) {
            Step step = Step.fromName(name);
            if (step == null) {
                throw new IllegalArgumentException("Unknown step '" + name + "' in " + owner);
            }
            steps.add(step);
        }
        return steps;
    }
}
