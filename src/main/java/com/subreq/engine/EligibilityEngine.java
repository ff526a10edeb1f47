package com.subreq.engine;

import com.subreq.condition.DefaultEligibilityEvaluator;
import com.subreq.condition.EligibilityEvaluator;
import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.Crosswalk;
import com.subreq.crosswalk.CrosswalkBuilder;
import com.subreq.crosswalk.CrosswalkSourceRow;
import com.subreq.requirement.CriteriaBuilder;
import com.subreq.requirement.SubRequirementCriteria;
import com.subreq.requirement.SubRequirementRaw;
import com.subreq.result.EligibilityResult;
import com.subreq.result.ResultAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Entry point of the matching engine.
 * <p>
 * Stateless apart from the evaluator's condition cache: the same inputs always give
 * the same result set, so a failed batch can simply be run again.
 */
public class EligibilityEngine {

    private static final Logger log = LoggerFactory.getLogger(EligibilityEngine.class);

    private final EligibilityEvaluator evaluator;
    private final ResultAssembler assembler;

    public EligibilityEngine() {
        this(new DefaultEligibilityEvaluator());
    }

    public EligibilityEngine(EligibilityEvaluator evaluator) {
        this.evaluator = evaluator;
        this.assembler = new ResultAssembler(evaluator);
    }

    public CrosswalkBuilder.Result buildCrosswalk(List<CrosswalkSourceRow> source) {
        return CrosswalkBuilder.build(source);
    }

    public List<SubRequirementCriteria> buildCriteria(List<SubRequirementRaw> rows) {
        return new CriteriaBuilder().buildAll(rows);
    }

    /**
     * Evaluate one batch of sub-requirement rows against all offered courses.
     *
     * @param rows      Raw sub-requirement rows of the batch
     * @param courses   Offered courses
     * @param crosswalk Crosswalk shared by all batches
     * @return Batch results and counters
     */
    public BatchResult evaluate(List<SubRequirementRaw> rows, List<OfferedCourse> courses, Crosswalk crosswalk) {
        CriteriaBuilder criteriaBuilder = new CriteriaBuilder();
        List<SubRequirementCriteria> criteria = criteriaBuilder.buildAll(rows);
        Set<EligibilityResult> results = assembler.assemble(criteria, courses, crosswalk);

        log.debug("Evaluated batch of {} rows ({} criteria rows): {} results",
                rows.size(), criteria.size(), results.size());
        return new BatchResult(results, criteriaBuilder.rowsRead(), criteriaBuilder.rowsProduced(),
                criteriaBuilder.filteredValues());
    }

    public EligibilityEvaluator getEvaluator() {
        return evaluator;
    }
}
