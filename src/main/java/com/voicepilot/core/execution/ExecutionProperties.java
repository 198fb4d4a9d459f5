package com.voicepilot.core.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "voicepilot.execution")
public class ExecutionProperties {

    /** Upper bound on a single actuator call. */
    private int actuatorTimeoutSeconds = 30;

    public int getActuatorTimeoutSeconds() {
        return actuatorTimeoutSeconds;
    }

    public void setActuatorTimeoutSeconds(int actuatorTimeoutSeconds) {
        this.actuatorTimeoutSeconds = actuatorTimeoutSeconds;
    }
}
