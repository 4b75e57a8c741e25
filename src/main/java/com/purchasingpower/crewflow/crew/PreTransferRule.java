package com.purchasingpower.crewflow.crew;

/**
 * Evaluated after field extraction and before the crew replies. Returning true discards
 * the crew's reply and moves the conversation to {@code transitionTo} for this same message.
 *
 * <p>Context store side effects must be idempotent when the rule returns false.
 */
@FunctionalInterface
public interface PreTransferRule {

    boolean shouldTransfer(HookContext context);
}
