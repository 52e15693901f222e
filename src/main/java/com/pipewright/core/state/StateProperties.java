package com.pipewright.core.state;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where run state lives on disk.
 * <p>
 * {@code root} is the canonical location and the only one ever written.
 * {@code legacyRoot} holds state written by older releases inside the
 * working trees and is read as a fallback only.
 */
@Component
@ConfigurationProperties(prefix = "pipewright.state")
public class StateProperties {

    private String root = "agents";
    private String legacyRoot = "trees";
    private String fileName = "run_state.json";

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public String getLegacyRoot() { return legacyRoot; }
    public void setLegacyRoot(String legacyRoot) { this.legacyRoot = legacyRoot; }
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
}
