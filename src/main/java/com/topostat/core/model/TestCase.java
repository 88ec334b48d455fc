package com.topostat.core.model;

/**
 * Upstream test case as produced by a report parser.
 * <p>
 * {@code result} is deliberately untyped: report libraries expose either a single
 * {@link CaseResult} or a list of them. {@link OutcomeClassifier} normalizes both.
 */
public record TestCase(String classname, String name, double time, Object result) {

    public String qualifiedName() {
        return classname + "." + name;
    }
}
