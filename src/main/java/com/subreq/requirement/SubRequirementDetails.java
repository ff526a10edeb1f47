package com.subreq.requirement;

/**
 * Descriptive sub-requirement columns carried through to the result.
 *
 * @param rname    Requirement name
 * @param subreqId Sub-requirement id as used by audits
 * @param rqfyt    First active term
 * @param lyt      Last active term
 * @param rqfyt2   First active term of a referenced course list
 * @param lyt2     Last active term of a referenced course list
 * @param rtitle1  Requirement title
 * @param seq1     Sub-requirement number
 * @param seq2     Course sort order
 * @param seq3     List sort order
 * @param seq4     List course sort order
 * @param course   Course pattern, e.g. "MAT", "MAT 3**" or blank
 * @param tflg     Course title is part of the requirement
 * @param ctitle   Course title match code
 * @param matchctl Match control flags
 * @param grp      "H" when measured by hours, "C" when measured by courses
 * @param grpmin   Minimum groups to satisfy
 * @param grpmax   Maximum groups to satisfy
 * @param hcmin    Minimum hours or courses per group
 * @param hcmax    Maximum hours or courses per group
 */
public record SubRequirementDetails(
        String rname,
        String subreqId,
        String rqfyt,
        String lyt,
        String rqfyt2,
        String lyt2,
        String rtitle1,
        String seq1,
        String seq2,
        String seq3,
        String seq4,
        String course,
        String tflg,
        String ctitle,
        String matchctl,
        String grp,
        String grpmin,
        String grpmax,
        String hcmin,
        String hcmax
) {

    public SubRequirementKey key() {
        return new SubRequirementKey(rname, subreqId, rqfyt, lyt, rqfyt2, lyt2, seq1, seq2, seq3, seq4, rtitle1);
    }

    /**
     * Copy with the four term columns converted to term codes.
     */
    public SubRequirementDetails withTermCodes() {
        return new SubRequirementDetails(rname, subreqId,
                RequirementTerm.toTermCode(rqfyt), RequirementTerm.toTermCode(lyt),
                RequirementTerm.toTermCode(rqfyt2), RequirementTerm.toTermCode(lyt2),
                rtitle1, seq1, seq2, seq3, seq4, course, tflg, ctitle, matchctl,
                grp, grpmin, grpmax, hcmin, hcmax);
    }
}
