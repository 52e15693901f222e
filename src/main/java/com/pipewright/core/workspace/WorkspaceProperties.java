package com.pipewright.core.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pipewright.workspace")
public class WorkspaceProperties {

    private String repoRoot = ".";
    private String treesDir = "trees";
    private String registryFile = "agents/workspace_slots.json";
    private int maxSlots = 15;
    private int poolSize = 100;
    private int backendPortStart = 9100;
    private int frontendPortStart = 9200;
    private String baseRef = "HEAD";
    private String branchPrefix = "pipewright/";
    private int staleAfterHours = 24;
    private int gitTimeoutSeconds = 60;

    public String getRepoRoot() { return repoRoot; }
    public void setRepoRoot(String repoRoot) { this.repoRoot = repoRoot; }
    public String getTreesDir() { return treesDir; }
    public void setTreesDir(String treesDir) { this.treesDir = treesDir; }
    public String getRegistryFile() { return registryFile; }
    public void setRegistryFile(String registryFile) { this.registryFile = registryFile; }
    public int getMaxSlots() { return maxSlots; }
    public void setMaxSlots(int maxSlots) { this.maxSlots = maxSlots; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public int getBackendPortStart() { return backendPortStart; }
    public void setBackendPortStart(int backendPortStart) { this.backendPortStart = backendPortStart; }
    public int getFrontendPortStart() { return frontendPortStart; }
    public void setFrontendPortStart(int frontendPortStart) { this.frontendPortStart = frontendPortStart; }
    public String getBaseRef() { return baseRef; }
    public void setBaseRef(String baseRef) { this.baseRef = baseRef; }
    public String getBranchPrefix() { return branchPrefix; }
    public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    public int getStaleAfterHours() { return staleAfterHours; }
    public void setStaleAfterHours(int staleAfterHours) { this.staleAfterHours = staleAfterHours; }
    public int getGitTimeoutSeconds() { return gitTimeoutSeconds; }
    public void setGitTimeoutSeconds(int gitTimeoutSeconds) { this.gitTimeoutSeconds = gitTimeoutSeconds; }
}
