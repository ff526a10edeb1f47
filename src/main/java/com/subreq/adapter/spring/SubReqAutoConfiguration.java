package com.subreq.adapter.spring;

import com.subreq.batch.RequirementYearBatchRunner;
import com.subreq.config.ConfigLoader;
import com.subreq.config.RunConfig;
import com.subreq.engine.EligibilityEngine;
import com.subreq.engine.EligibilityRun;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the eligibility engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "subreq", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SubReqProperties.class)
public class SubReqAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SubReqAutoConfiguration.class);

    private RequirementYearBatchRunner batchRunner;

    @Bean
    @ConditionalOnMissingBean
    public RunConfig runConfig(SubReqProperties properties) {
        log.info("Loading run configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityEngine eligibilityEngine() {
        return new EligibilityEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RequirementYearBatchRunner requirementYearBatchRunner(EligibilityEngine engine, RunConfig config) {
        log.info("Creating batch runner for '{}' with parallelism {}", config.name(), config.batch().parallelism());
        this.batchRunner = new RequirementYearBatchRunner(engine, config.batch().parallelism());
        return this.batchRunner;
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityRun eligibilityRun(EligibilityEngine engine, RequirementYearBatchRunner runner) {
        return new EligibilityRun(engine, runner);
    }

    @PreDestroy
    public void shutdown() {
        if (batchRunner != null && !batchRunner.isShutdown()) {
            log.info("Shutting down batch runner");
            batchRunner.shutdown();
        }
    }
}
