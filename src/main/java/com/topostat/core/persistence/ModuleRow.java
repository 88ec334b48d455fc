package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class ModuleRow extends Dimension {

    private final String name;
    private final DirectoryRow directory;

    public ModuleRow(String name, DirectoryRow directory) {
        this.name = name;
        this.directory = directory;
    }

    public String getName() {
        return name;
    }

    public DirectoryRow getDirectory() {
        return directory;
    }

    @Override
    public DimensionType type() {
        return DimensionType.MODULE;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.module(name, directory != null ? directory.getName() : null);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name) && directory != null && directory.isValid();
    }
}
