package com.subreq.engine;

import com.subreq.batch.BatchRun;
import com.subreq.batch.RequirementYearBatchRunner;
import com.subreq.config.RunConfig;
import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.CrosswalkBuilder;
import com.subreq.io.CsvTable;
import com.subreq.io.EligibilityResultWriter;
import com.subreq.io.TableSources;
import com.subreq.requirement.SubRequirementRaw;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * One full run: read the three input tables, build the crosswalk, evaluate all
 * requirement-year batches and write the result table.
 */
public class EligibilityRun {

    private static final Logger log = LoggerFactory.getLogger(EligibilityRun.class);

    private final EligibilityEngine engine;
    private final RequirementYearBatchRunner runner;

    public EligibilityRun(EligibilityEngine engine, RequirementYearBatchRunner runner) {
        this.engine = engine;
        this.runner = runner;
    }

    /**
     * Execute a run.
     *
     * @param config Run configuration; every input and the output must be set
     * @return Counters of the run
     */
    public RunReport execute(RunConfig config) {
        config.validateForRun();
        log.info("Starting run '{}'", config.name());

        CrosswalkBuilder.Result crosswalk = engine.buildCrosswalk(
                TableSources.crosswalk(CsvTable.read(config.inputs().crosswalk())));
        List<SubRequirementRaw> rows = TableSources.subRequirements(
                CsvTable.read(config.inputs().subRequirements()));
        List<OfferedCourse> courses = TableSources.offeredCourses(
                CsvTable.read(config.inputs().offeredCourses()));

        BatchRun run = runner.run(rows, courses, crosswalk.crosswalk());
        EligibilityResultWriter.write(run.results(), Path.of(config.output()));

        RunReport report = new RunReport(crosswalk.report(), run.batches(), run.rowsRead(), run.criteriaRows(),
                run.filteredValues(), courses.size(), run.results().size());
        log.info("Run '{}' complete: {}", config.name(), report);
        return report;
    }
}
