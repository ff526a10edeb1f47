package com.subreq.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the eligibility run.
 */
@ConfigurationProperties(prefix = "subreq")
public class SubReqProperties {

    /**
     * Whether the engine beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the run configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:subreq.yaml";

    /**
     * Whether the application executes a run when it starts.
     */
    private boolean runOnStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
