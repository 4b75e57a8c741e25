package com.purchasingpower.crewflow.transition;

import com.purchasingpower.crewflow.crew.CrewDefinition;
import lombok.Value;

import java.util.List;

/**
 * Crew that should answer the current message after the pre-transfer chain ran,
 * with every hop taken to get there.
 */
@Value
public class PreTransferOutcome {

    CrewDefinition respondingCrew;

    List<CrewTransition> hops;

    public boolean transferred() {
        return !hops.isEmpty();
    }
}
