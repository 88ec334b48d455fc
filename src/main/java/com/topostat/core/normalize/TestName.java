package com.topostat.core.normalize;

import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;

/**
 * Composed test name split into its {@code directory.module.test} segments.
 */
public record TestName(String directory, String module, String test) {

    private static final int SEGMENTS = 3;

    /**
     * Splits {@code name} on dots. Exactly three segments are required, each non-empty
     * after trimming.
     */
    public static Attempt<TestName> parse(String name) {
        if (name == null) {
            return Attempt.fail(ErrorKind.NORMALIZATION, "Missing test name");
        }
        String[] segments = name.strip().split("\\.", -1);
        if (segments.length != SEGMENTS) {
            return Attempt.fail(ErrorKind.NORMALIZATION,
                    "Test name '" + name + "' has " + segments.length + " segment(s), expected " + SEGMENTS);
        }
        for (int i = 0; i < SEGMENTS; i++) {
            segments[i] = segments[i].strip();
            if (segments[i].isEmpty()) {
                return Attempt.fail(ErrorKind.NORMALIZATION, "Test name '" + name + "' has an empty segment");
            }
        }
        return Attempt.ok(new TestName(segments[0], segments[1], segments[2]));
    }
}
