package com.pipewright.core.validation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "pipewright.validation")
public class ValidationProperties {

    private long minPlanBytes = 100;
    private List<String> requiredPlanSections = new ArrayList<>(
            List.of("## Objective", "## Implementation", "## Testing"));

    public long getMinPlanBytes() { return minPlanBytes; }
    public void setMinPlanBytes(long minPlanBytes) { this.minPlanBytes = minPlanBytes; }
    public List<String> getRequiredPlanSections() { return requiredPlanSections; }
    public void setRequiredPlanSections(List<String> requiredPlanSections) { this.requiredPlanSections = requiredPlanSections; }
}
