package io.cortex.core.index;

/**
 * Roughly four characters per token.
 */
public final class HeuristicTokenizer implements Tokenizer {
    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public int estimateTokens(String content) {
        if (content == null) {
            return 0;
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return Math.max(1, (trimmed.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }
}
