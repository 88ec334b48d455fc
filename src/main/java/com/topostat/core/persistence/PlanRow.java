package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class PlanRow extends Dimension {

    private final String name;

    public PlanRow(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.PLAN;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.plan(name);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name);
    }
}
