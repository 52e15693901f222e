package com.pipewright.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "pipewright.executor")
public class ExecutorProperties {

    /** Step name (e.g. "build") to the command that performs it. */
    private Map<String, List<String>> commands = new LinkedHashMap<>();

    private int timeoutSeconds = 1800;

    /** Command that starts a new Pipewright process; "step <run-id> <step>" is appended. */
    private List<String> launcherCommand = new ArrayList<>(List.of("java", "-jar", "pipewright.jar"));

    public Map<String, List<String>> getCommands() { return commands; }
    public void setCommands(Map<String, List<String>> commands) { this.commands = commands; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public List<String> getLauncherCommand() { return launcherCommand; }
    public void setLauncherCommand(List<String> launcherCommand) { this.launcherCommand = launcherCommand; }
}
