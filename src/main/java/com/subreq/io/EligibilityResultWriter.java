package com.subreq.io;

import com.subreq.exception.SubReqException;
import com.subreq.requirement.SubRequirementDetails;
import com.subreq.result.EligibilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes eligibility results as a flat CSV table, gzip-compressed when the path ends in ".gz".
 * <p>
 * Rows are sorted by sub-requirement then course, so unchanged inputs produce an
 * identical file.
 */
public final class EligibilityResultWriter {

    private static final Logger log = LoggerFactory.getLogger(EligibilityResultWriter.class);

    public static final List<String> COLUMNS = List.of(
            "rname", "subreq_id", "rqfyt", "lyt", "rqfyt2", "lyt2", "seq1", "seq2", "seq3", "rtitle1",
            "full_crse", "crse_id", "units_minimum", "units_maximum", "tflg", "ctitle", "matchctl",
            "grp", "grpmin", "grpmax", "hcmin", "hcmax");

    private EligibilityResultWriter() {
    }

    public static void write(Collection<EligibilityResult> results, Path path) {
        log.info("Writing {} results to: {}", results.size(), path);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream file = Files.newOutputStream(path);
                 OutputStream out = path.toString().endsWith(".gz") ? new GZIPOutputStream(file) : file;
                 Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
                write(results, writer);
            }
        } catch (IOException e) {
            throw new SubReqException("Failed to write results to: " + path, e);
        }
    }

    public static void write(Collection<EligibilityResult> results, Writer writer) throws IOException {
        List<EligibilityResult> sorted = new ArrayList<>(results);
        sorted.sort(EligibilityResult.ORDER);

        writeRecord(writer, COLUMNS);
        for (EligibilityResult result : sorted) {
            writeRecord(writer, toRecord(result));
        }
        writer.flush();
    }

    static List<String> toRecord(EligibilityResult result) {
        SubRequirementDetails d = result.details();
        return List.of(
                nvl(d.rname()), nvl(d.subreqId()), nvl(d.rqfyt()), nvl(d.lyt()), nvl(d.rqfyt2()), nvl(d.lyt2()),
                nvl(d.seq1()), nvl(d.seq2()), nvl(d.seq4()), nvl(d.rtitle1()),
                nvl(result.course().fullCourse()), nvl(result.course().crseId()),
                nvl(result.course().unitsMinimum()), nvl(result.course().unitsMaximum()),
                nvl(d.tflg()), nvl(d.ctitle()), nvl(d.matchctl()),
                nvl(d.grp()), nvl(d.grpmin()), nvl(d.grpmax()), nvl(d.hcmin()), nvl(d.hcmax()));
    }

    private static void writeRecord(Writer writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(values.get(i)));
        }
        writer.write('\n');
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String nvl(String value) {
        return value == null ? "" : value;
    }
}
