package com.topostat.core.model;

/**
 * A tagged result element attached to an upstream test case
 * ({@code <failure>}, {@code <error>} or {@code <skipped>} in a JUnit report).
 */
public record CaseResult(Tag tag, String message) {

    public enum Tag { FAILURE, ERROR, SKIPPED }
}
