package com.purchasingpower.crewflow.crew;

import java.util.Map;

/**
 * Builds the runtime context object handed to the model alongside the crew's guidance.
 */
@FunctionalInterface
public interface ContextBuilder {

    Map<String, Object> buildContext(HookContext context);
}
