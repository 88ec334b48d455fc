package com.topostat.agent;

import com.topostat.core.model.TestCase;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads test cases from a JUnit XML report.
 */
public interface JUnitReportParser {

    List<TestCase> parse(InputStream report) throws IOException;

    default List<TestCase> parse(Path report) throws IOException {
        try (InputStream in = Files.newInputStream(report)) {
            return parse(in);
        }
    }
}
