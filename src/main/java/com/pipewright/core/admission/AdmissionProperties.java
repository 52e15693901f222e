package com.pipewright.core.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "pipewright.admission")
public class AdmissionProperties {

    /** Command running a small self-test of the pipeline; empty disables the check. */
    private List<String> selfTestCommand = new ArrayList<>();
    private int selfTestTimeoutSeconds = 5;

    /** Tool name to the command that proves it is installed. */
    private Map<String, List<String>> tools = new LinkedHashMap<>(Map.of("git", List.of("git", "--version")));

    /** Paths in the main checkout that never count as uncommitted changes. */
    private List<String> ignoredPaths = new ArrayList<>(List.of("trees/", "agents/", "pipewright.db"));

    private double minFreeDiskGb = 1.0;
    private int checkTimeoutSeconds = 3;
    /** Upper bound for one admission pass over all checks. */
    private int totalBudgetSeconds = 9;

    public List<String> getSelfTestCommand() { return selfTestCommand; }
    public void setSelfTestCommand(List<String> selfTestCommand) { this.selfTestCommand = selfTestCommand; }
    public int getSelfTestTimeoutSeconds() { return selfTestTimeoutSeconds; }
    public void setSelfTestTimeoutSeconds(int selfTestTimeoutSeconds) { this.selfTestTimeoutSeconds = selfTestTimeoutSeconds; }
    public Map<String, List<String>> getTools() { return tools; }
    public void setTools(Map<String, List<String>> tools) { this.tools = tools; }
    public List<String> getIgnoredPaths() { return ignoredPaths; }
    public void setIgnoredPaths(List<String> ignoredPaths) { this.ignoredPaths = ignoredPaths; }
    public double getMinFreeDiskGb() { return minFreeDiskGb; }
    public void setMinFreeDiskGb(double minFreeDiskGb) { this.minFreeDiskGb = minFreeDiskGb; }
    public int getCheckTimeoutSeconds() { return checkTimeoutSeconds; }
    public void setCheckTimeoutSeconds(int checkTimeoutSeconds) { this.checkTimeoutSeconds = checkTimeoutSeconds; }
    public int getTotalBudgetSeconds() { return totalBudgetSeconds; }
    public void setTotalBudgetSeconds(int totalBudgetSeconds) { this.totalBudgetSeconds = totalBudgetSeconds; }
}
