package com.topostat.core.model;

import com.topostat.core.check.Checks;

/**
 * CI coordinates attached to every record an agent produces.
 */
public record BuildContext(String agentName, String planName, int buildNumber, String jobName) {

    public boolean isValid() {
        return Checks.isNonEmpty(agentName)
                && Checks.isNonEmpty(planName)
                && buildNumber >= 1
                && Checks.isNonEmpty(jobName);
    }
}
