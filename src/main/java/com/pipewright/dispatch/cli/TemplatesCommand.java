package com.pipewright.dispatch.cli;

import com.pipewright.core.model.Step;
import com.pipewright.core.pipeline.PipelineCatalog;
import com.pipewright.core.pipeline.PipelineTemplate;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * CLI command: pipewright templates
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List pipeline templates")
@Component
public class TemplatesCommand implements Runnable {

    private final PipelineCatalog catalog;

    public TemplatesCommand(PipelineCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-24s %s%n", "TEMPLATE", "STEPS (* = terminal)");
        System.out.println("  " + "-".repeat(64));
        for (PipelineTemplate template : catalog.templates()) {
            String steps = template.steps().stream()
                    .map(step -> label(template, step))
                    .collect(Collectors.joining(" > "));
            String name = template.name().equals(catalog.defaultTemplate())
                    ? template.name() + " (default)"
                    : template.name();
            System.out.printf("  %-24s %s%n", name, steps);
        }
    }

    private static String label(PipelineTemplate template, Step step) {
        return template.isTerminal(step) ? step.displayName() + "*" : step.displayName();
    }
}
