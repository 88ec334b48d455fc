package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class JobRow extends Dimension {

    private final String name;
    private final PlanRow plan;

    public JobRow(String name, PlanRow plan) {
        this.name = name;
        this.plan = plan;
    }

    public String getName() {
        return name;
    }

    public PlanRow getPlan() {
        return plan;
    }

    @Override
    public DimensionType type() {
        return DimensionType.JOB;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.job(name, plan != null ? plan.getName() : null);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name) && plan != null && plan.isValid();
    }
}
