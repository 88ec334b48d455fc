package com.topostat.core.persistence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Business key of a dimension row. Parent references are expressed through the
 * parents' own key parts, so keys can be built before any row is persisted.
 * Parts may be {@code null} for incomplete rows; such keys never match a stored row.
 */
public record NaturalKey(DimensionType type, List<String> parts) {

    public NaturalKey {
        parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public static NaturalKey directory(String name) {
        return new NaturalKey(DimensionType.DIRECTORY, Arrays.asList(name));
    }

    public static NaturalKey module(String name, String directory) {
        return new NaturalKey(DimensionType.MODULE, Arrays.asList(name, directory));
    }

    public static NaturalKey test(String name, String module, String directory) {
        return new NaturalKey(DimensionType.TEST, Arrays.asList(name, module, directory));
    }

    public static NaturalKey agent(String name) {
        return new NaturalKey(DimensionType.AGENT, Arrays.asList(name));
    }

    public static NaturalKey plan(String name) {
        return new NaturalKey(DimensionType.PLAN, Arrays.asList(name));
    }

    public static NaturalKey build(int number, String plan) {
        return new NaturalKey(DimensionType.BUILD, Arrays.asList(String.valueOf(number), plan));
    }

    public static NaturalKey job(String name, String plan) {
        return new NaturalKey(DimensionType.JOB, Arrays.asList(name, plan));
    }

    @Override
    public String toString() {
        return type + "(" + String.join("/", parts) + ")";
    }
}
