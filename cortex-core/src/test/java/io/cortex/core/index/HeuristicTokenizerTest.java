package io.cortex.core.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HeuristicTokenizerTest {

    private final HeuristicTokenizer tokenizer = new HeuristicTokenizer();

    @Test
    void shouldEstimateAboutFourCharactersPerToken() {
        assertThat(tokenizer.estimateTokens("abcd")).isEqualTo(1);
        assertThat(tokenizer.estimateTokens("abcde")).isEqualTo(2);
        assertThat(tokenizer.estimateTokens("  abcdefgh  ")).isEqualTo(2);
    }

    @Test
    void shouldReturnZeroForBlankContent() {
        assertThat(tokenizer.estimateTokens("")).isZero();
        assertThat(tokenizer.estimateTokens("  \n ")).isZero();
        assertThat(tokenizer.estimateTokens(null)).isZero();
    }

    @Test
    void shouldCountAtLeastOneTokenForShortContent() {
        assertThat(tokenizer.estimateTokens("a")).isEqualTo(1);
    }
}
