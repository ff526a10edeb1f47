package com.subreq.result;

import com.subreq.code.CodeSet;
import com.subreq.condition.CourseFacts;
import com.subreq.condition.EligibilityEvaluator;
import com.subreq.course.CoursePattern;
import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.Crosswalk;
import com.subreq.requirement.SubRequirementCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins offered courses against sub-requirement criteria.
 * <p>
 * A course is looked up in the crosswalk by designation (falling back to the
 * no-designation row) and satisfies a sub-requirement when it matches the course
 * pattern and at least one of its code set alternatives is accepted. Each
 * (course, sub-requirement) pair appears at most once in the result.
 */
public class ResultAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

    private final EligibilityEvaluator evaluator;

    public ResultAssembler(EligibilityEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Produce the distinct eligibility results.
     *
     * @param criteria  Sub-requirement criteria rows
     * @param courses   Offered courses
     * @param crosswalk Designation to code set table
     * @return Distinct results in criteria order, then course order
     */
    public Set<EligibilityResult> assemble(List<SubRequirementCriteria> criteria,
                                           List<OfferedCourse> courses,
                                           Crosswalk crosswalk) {
        List<CourseAlternatives> candidates = new ArrayList<>(courses.size());
        for (OfferedCourse course : courses) {
            List<CourseFacts> facts = new ArrayList<>();
            for (CodeSet codes : crosswalk.codeSetsFor(course.designation())) {
                facts.add(new CourseFacts(codes, course.division().orElse(null)));
            }
            candidates.add(new CourseAlternatives(course, facts));
        }

        Map<String, CoursePattern> patterns = new HashMap<>();
        Map<EligibilityResult.ResultKey, EligibilityResult> results = new LinkedHashMap<>();

        for (SubRequirementCriteria row : criteria) {
            CoursePattern pattern = patterns.computeIfAbsent(
                    row.details().course() == null ? "" : row.details().course(), CoursePattern::compile);
            if (pattern.isBlank()) {
                log.debug("Sub-requirement {} has no course pattern, no course can match", row.key());
                continue;
            }

            for (CourseAlternatives candidate : candidates) {
                if (!pattern.matches(candidate.course().fullCourse())) {
                    continue;
                }
                EligibilityResult result = new EligibilityResult(row.details(), candidate.course());
                if (results.containsKey(result.resultKey())) {
                    continue;
                }
                if (acceptsAny(candidate, row)) {
                    results.put(result.resultKey(), result);
                }
            }
        }

        log.debug("Assembled {} results from {} criteria rows and {} courses",
                results.size(), criteria.size(), courses.size());
        return new LinkedHashSet<>(results.values());
    }

    private boolean acceptsAny(CourseAlternatives candidate, SubRequirementCriteria row) {
        for (CourseFacts facts : candidate.facts()) {
            if (evaluator.accepts(facts, row)) {
                return true;
            }
        }
        return false;
    }

    private record CourseAlternatives(OfferedCourse course, List<CourseFacts> facts) {
    }
}
