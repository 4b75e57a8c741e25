package com.purchasingpower.crewflow.crew;

/**
 * Evaluated after the crew's reply has been delivered. Returning true moves the
 * conversation to {@code transitionTo} starting with the next message.
 *
 * <p>Context store side effects must be idempotent when the rule returns false.
 */
@FunctionalInterface
public interface PostTransferRule {

    boolean shouldTransfer(HookContext context, String reply);
}
