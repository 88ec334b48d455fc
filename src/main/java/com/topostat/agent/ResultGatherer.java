package com.topostat.agent;

import com.topostat.core.model.BuildContext;
import com.topostat.core.model.PlatformInfo;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.model.TestCase;
import com.topostat.core.model.WireFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns parsed test cases into uploadable records. Invalid records are counted and
 * dropped; skipped cases are counted but never uploaded.
 */
@Component
public class ResultGatherer {

    private static final Logger log = LoggerFactory.getLogger(ResultGatherer.class);

    public Gathered gather(List<TestCase> cases, BuildContext context, PlatformInfo platform) {
        Instant timestamp = WireFormat.now();
        List<ResultRecord> records = new ArrayList<>();
        int invalid = 0;
        int skipped = 0;
        for (TestCase testCase : cases) {
            ResultRecord record = ResultRecord.fromCase(testCase, context, timestamp, platform);
            if (!record.validate()) {
                invalid++;
                log.debug("Dropping invalid result '{}'", record.name());
            } else if (record.skipped()) {
                skipped++;
            } else {
                records.add(record);
            }
        }
        Gathered gathered = new Gathered(records, cases.size(), skipped, invalid);
        log.info("Gathered {} test results ({} valid, {} skipped, {} invalid)",
                gathered.total(), gathered.valid(), gathered.skipped(), gathered.invalid());
        return gathered;
    }

    /**
     * @param records valid, non-skipped records to upload
     */
    public record Gathered(List<ResultRecord> records, int total, int skipped, int invalid) {

        public Gathered {
            records = List.copyOf(records);
        }

        public int valid() {
            return records.size();
        }
    }
}
