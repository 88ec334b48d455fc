package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class AgentRow extends Dimension {

    private final String name;

    public AgentRow(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.AGENT;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.agent(name);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name);
    }
}
