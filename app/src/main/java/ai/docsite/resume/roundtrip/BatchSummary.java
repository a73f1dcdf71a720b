package ai.docsite.resume.roundtrip;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports of a batch run, grouped by outcome.
 */
public record BatchSummary(List<RoundtripReport> passed, List<RoundtripReport> failed,
                           List<RoundtripReport> errored) {

    public BatchSummary {
        passed = List.copyOf(passed);
        failed = List.copyOf(failed);
        errored = List.copyOf(errored);
    }

    public static BatchSummary of(List<RoundtripReport> reports) {
        List<RoundtripReport> passed = new ArrayList<>();
        List<RoundtripReport> failed = new ArrayList<>();
        List<RoundtripReport> errored = new ArrayList<>();
        for (RoundtripReport report : reports) {
            if (report.hasError()) {
                errored.add(report);
            } else if (report.passed()) {
                passed.add(report);
            } else {
                failed.add(report);
            }
        }
        return new BatchSummary(passed, failed, errored);
    }

    public int total() {
        return passed.size() + failed.size() + errored.size();
    }

    public boolean allPassed() {
        return failed.isEmpty() && errored.isEmpty();
    }
}
