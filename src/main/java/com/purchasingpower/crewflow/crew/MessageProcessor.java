package com.purchasingpower.crewflow.crew;

/**
 * Rewrites the text passing through a crew's generation.
 *
 * <p>{@link #preProcess} shapes the user message the model sees; the stored history keeps the
 * original. {@link #postProcess} shapes the final reply that is stored, returned and handed to
 * the post-transfer rule. Streamed tokens are not rewritten.
 */
public interface MessageProcessor {

    default String preProcess(String message, HookContext context) {
        return message;
    }

    default String postProcess(String reply, HookContext context) {
        return reply;
    }
}
