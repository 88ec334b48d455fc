package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class DirectoryRow extends Dimension {

    private final String name;

    public DirectoryRow(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.DIRECTORY;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.directory(name);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name);
    }
}
