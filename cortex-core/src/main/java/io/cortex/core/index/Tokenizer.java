package io.cortex.core.index;

/**
 * Deterministic size metric for memory content.
 */
@FunctionalInterface
public interface Tokenizer {

    int estimateTokens(String content);
}
