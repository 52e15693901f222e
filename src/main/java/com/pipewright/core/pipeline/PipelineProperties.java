package com.pipewright.core.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "pipewright.pipeline")
public class PipelineProperties {

    /** Additional or overriding templates: name to ordered step names. */
    private Map<String, List<String>> templates = new LinkedHashMap<>();

    /** Steps after which a run never chains automatically. */
    private List<String> terminalSteps = new ArrayList<>(List.of("Ship", "Cleanup", "Verify"));

    private String defaultTemplate = "sdlc_complete";

    private ChainingMode chaining = ChainingMode.PROCESS;

    public Map<String, List<String>> getTemplates() { return templates; }
    public void setTemplates(Map<String, List<String>> templates) { this.templates = templates; }
    public List<String> getTerminalSteps() { return terminalSteps; }
    public void setTerminalSteps(List<String> terminalSteps) { this.terminalSteps = terminalSteps; }
    public String getDefaultTemplate() { return defaultTemplate; }
    public void setDefaultTemplate(String defaultTemplate) { this.defaultTemplate = defaultTemplate; }
    public ChainingMode getChaining() { return chaining; }
    public void setChaining(ChainingMode chaining) { this.chaining = chaining; }
}
