package com.topostat.core.model;

import com.topostat.core.check.Checks;

/**
 * Agent platform description carried by version 2 result records.
 */
public record PlatformInfo(String osName, String archName, String kernelVersion) {

    public boolean isValid() {
        return Checks.isNonEmpty(osName)
                && Checks.isNonEmpty(archName)
                && Checks.isNonEmpty(kernelVersion);
    }
}
