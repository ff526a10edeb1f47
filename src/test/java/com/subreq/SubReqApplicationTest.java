package com.subreq;

import com.subreq.adapter.spring.SubReqProperties;
import com.subreq.batch.RequirementYearBatchRunner;
import com.subreq.config.RunConfig;
import com.subreq.engine.EligibilityRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Application context tests. The runner is disabled by the test application.yml.
 */
@SpringBootTest
class SubReqApplicationTest {

    @Autowired
    private SubReqProperties properties;

    @Autowired
    private RunConfig config;

    @Autowired
    private RequirementYearBatchRunner runner;

    @Autowired
    private EligibilityRun run;

    @Test
    @DisplayName("Context loads the test run configuration")
    void contextLoads() {
        assertEquals("classpath:subreq-test.yaml", properties.getConfigPath());
        assertFalse(properties.isRunOnStartup());
        assertEquals("fixture-run", config.name());
        assertEquals(2, runner.getParallelism());
        assertNotNull(run);
    }
}
