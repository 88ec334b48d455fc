package com.topostat.core.persistence;

import com.topostat.core.check.Checks;

public class TestRow extends Dimension {

    private final String name;
    private final ModuleRow module;
    private final DirectoryRow directory;

    public TestRow(String name, ModuleRow module, DirectoryRow directory) {
        this.name = name;
        this.module = module;
        this.directory = directory;
    }

    public String getName() {
        return name;
    }

    public ModuleRow getModule() {
        return module;
    }

    public DirectoryRow getDirectory() {
        return directory;
    }

    @Override
    public DimensionType type() {
        return DimensionType.TEST;
    }

    @Override
    public NaturalKey naturalKey() {
        return NaturalKey.test(name,
                module != null ? module.getName() : null,
                directory != null ? directory.getName() : null);
    }

    @Override
    public boolean isValid() {
        return Checks.isNonEmpty(name)
                && module != null && module.isValid()
                && directory != null && directory.isValid();
    }
}
