package com.subreq;

import com.subreq.adapter.spring.SubReqProperties;
import com.subreq.config.RunConfig;
import com.subreq.engine.EligibilityRun;
import com.subreq.engine.RunReport;
import com.subreq.spring.EnableSubReq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command-line application computing sub-requirement course eligibility.
 */
@SpringBootApplication
@EnableSubReq
public class SubReqApplication {

    private static final Logger log = LoggerFactory.getLogger(SubReqApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SubReqApplication.class, args);
    }

    @Bean
    public CommandLineRunner eligibilityRunner(SubReqProperties properties, RunConfig config, EligibilityRun run) {
        return args -> {
            if (!properties.isRunOnStartup()) {
                log.info("Run on startup disabled, skipping '{}'", config.name());
                return;
            }
            log.info("=== Eligibility Run '{}' Started ===", config.name());
            RunReport report = run.execute(config);
            log.info("=== Eligibility Run Completed: {} results written to {} ===", report.results(), config.output());
        };
    }
}
