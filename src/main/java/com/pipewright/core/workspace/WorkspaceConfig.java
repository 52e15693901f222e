package com.pipewright.core.workspace;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class WorkspaceConfig {

    @Bean
    public GitWorktreeManager gitWorktreeManager(WorkspaceProperties properties) {
        return new GitWorktreeManager(Duration.ofSeconds(properties.getGitTimeoutSeconds()));
    }

    @Bean
    public SlotRegistry slotRegistry(WorkspaceProperties properties) {
        return new SlotRegistry(Path.of(properties.getRepoRoot()).resolve(properties.getRegistryFile()));
    }
}
