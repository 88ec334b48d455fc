package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class BuildRow extends Dimension {

    private final int number;
    private final PlanRow plan;

    public BuildRow(int number, PlanRow plan) {
        this.number = number;
        this.plan = plan;
    }

    public int getNumber() {
        return number;
    }

    public PlanRow getPlan() {
        return plan;
    }

    @Override
    public DimensionType type() {
        return DimensionType.BUILD;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.build(number, plan != null ? plan.getName() : null);
    }

    @Override
    public boolean isValid() {
        return Checks.isIntMin(number, 1) && plan != null && plan.isValid();
    }
}
