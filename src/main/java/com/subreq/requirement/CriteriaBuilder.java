package com.subreq.requirement;

import com.subreq.code.CodeSet;
import com.subreq.code.ConditionCode;
import com.subreq.code.Division;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives {@link SubRequirementCriteria} from raw sub-requirement rows.
 * <p>
 * Per row:
 * <ol>
 *   <li>whitespace is removed and missing values become empty;</li>
 *   <li>a column holding just "U" or "L" adds a division marker to its side;</li>
 *   <li>a column contributes a code only when its whole value is one condition code,
 *       everything else (GPA minimums, grades) is filtered out;</li>
 *   <li>when {@code acor} contains "-", each ac1..ac5 code becomes its own row;</li>
 *   <li>{@code ac_all = r_ac1 + r_ac2 + ac + ac1..ac5};</li>
 *   <li>rc1..rc5 go to {@code rc_and} when {@code rcand} is "-", otherwise to {@code rc_ord}
 *       together with r_rc1, r_rc2 and rc.</li>
 * </ol>
 * Not thread-safe; use one instance per batch.
 */
public class CriteriaBuilder {

    private static final Logger log = LoggerFactory.getLogger(CriteriaBuilder.class);

    static final String FLAG_MARKER = "-";

    private int rowsRead;
    private int rowsProduced;
    private int filteredValues;

    public List<SubRequirementCriteria> buildAll(List<SubRequirementRaw> rows) {
        List<SubRequirementCriteria> criteria = new ArrayList<>();
        for (SubRequirementRaw row : rows) {
            criteria.addAll(build(row));
        }
        log.debug("Derived {} criteria rows from {} sub-requirement rows ({} values filtered)",
                rowsProduced, rowsRead, filteredValues);
        return criteria;
    }

    /**
     * Derive criteria for one row.
     *
     * @param row Raw sub-requirement row
     * @return One or more criteria rows; more than one only when {@code acor} explodes the row
     */
    public List<SubRequirementCriteria> build(SubRequirementRaw row) {
        rowsRead++;

        StringBuilder acceptMarkers = new StringBuilder();
        StringBuilder rejectMarkers = new StringBuilder();
        Map<CriteriaField, ConditionCode> codes = new EnumMap<>(CriteriaField.class);

        for (CriteriaField field : CriteriaField.values()) {
            String value = clean(row.value(field));
            if (value.isEmpty()) {
                continue;
            }
            if (Division.isMarker(value)) {
                (field.side() == CriteriaField.Side.ACCEPT ? acceptMarkers : rejectMarkers).append(value);
                continue;
            }
            Optional<ConditionCode> code = ConditionCode.fromValue(value);
            if (code.isPresent()) {
                codes.put(field, code.get());
            } else {
                filteredValues++;
                log.trace("Filtered non-code value '{}' from column {}", value, field.column());
            }
        }

        CodeSet requirementAccept = collect(codes, CriteriaField.R_AC1, CriteriaField.R_AC2, CriteriaField.AC);
        CodeSet requirementReject = collect(codes, CriteriaField.R_RC1, CriteriaField.R_RC2, CriteriaField.RC);
        CodeSet flaggedReject = collect(codes,
                CriteriaField.RC1, CriteriaField.RC2, CriteriaField.RC3, CriteriaField.RC4, CriteriaField.RC5);

        boolean rejectTogether = FLAG_MARKER.equals(clean(row.rcand()));
        CodeSet rejectAll = rejectTogether ? flaggedReject : CodeSet.empty();
        CodeSet rejectAny = rejectTogether ? requirementReject : requirementReject.union(flaggedReject);

        SubRequirementDetails details = row.details().withTermCodes();
        Division acceptDivision = Division.fromMarkers(acceptMarkers.toString()).orElse(null);
        Division rejectDivision = Division.fromMarkers(rejectMarkers.toString()).orElse(null);

        List<SubRequirementCriteria> result = new ArrayList<>();
        for (CodeSet alternative : acceptAlternatives(row, codes)) {
            CriteriaCodes criteriaCodes = new CriteriaCodes(requirementAccept.union(alternative), rejectAll, rejectAny);
            result.add(new SubRequirementCriteria(details, criteriaCodes, acceptDivision, rejectDivision));
        }
        rowsProduced += result.size();
        return result;
    }

    /**
     * ac1..ac5 as one AND-group, or one alternative per code when {@code acor} carries the marker.
     */
    private List<CodeSet> acceptAlternatives(SubRequirementRaw row, Map<CriteriaField, ConditionCode> codes) {
        String acor = row.acor() == null ? "" : row.acor();
        if (!acor.contains(FLAG_MARKER)) {
            return List.of(collect(codes,
                    CriteriaField.AC1, CriteriaField.AC2, CriteriaField.AC3, CriteriaField.AC4, CriteriaField.AC5));
        }

        Set<CodeSet> alternatives = new LinkedHashSet<>();
        for (CriteriaField field : List.of(
                CriteriaField.AC1, CriteriaField.AC2, CriteriaField.AC3, CriteriaField.AC4, CriteriaField.AC5)) {
            ConditionCode code = codes.get(field);
            if (code != null) {
                alternatives.add(CodeSet.of(code));
            }
        }
        if (alternatives.isEmpty()) {
            return List.of(CodeSet.empty());
        }
        return List.copyOf(alternatives);
    }

    private static CodeSet collect(Map<CriteriaField, ConditionCode> codes, CriteriaField... fields) {
        CodeSet result = CodeSet.empty();
        for (CriteriaField field : fields) {
            ConditionCode code = codes.get(field);
            if (code != null) {
                result = result.with(code);
            }
        }
        return result;
    }

    private static String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("\\s+", "");
    }

    public int rowsRead() {
        return rowsRead;
    }

    public int rowsProduced() {
        return rowsProduced;
    }

    public int filteredValues() {
        return filteredValues;
    }
}
