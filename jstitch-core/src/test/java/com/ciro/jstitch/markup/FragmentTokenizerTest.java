package com.ciro.jstitch.markup;

import com.ciro.jstitch.markup.MarkupLexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FragmentTokenizerTest {

    @Test
    void completeFragmentLeavesNoRemainder() {
        FragmentTokenizer tokenizer = new FragmentTokenizer();
        FragmentTokenizer.Scan scan = tokenizer.feed("<b>x</b>");

        assertThat(scan.isComplete()).isTrue();
        assertThat(scan.carriedLength()).isZero();
        assertThat(scan.tokens()).last().extracting(MarkupLexer.Token::type).isEqualTo(TokenType.END_OF_INPUT);
        assertThat(tokenizer.hasRemainder()).isFalse();
    }

    @Test
    void carriesTheUnfinishedTagIntoTheNextFragment() {
        FragmentTokenizer tokenizer = new FragmentTokenizer();

        FragmentTokenizer.Scan first = tokenizer.feed("hi <foo bar=\"17\"");
        assertThat(first.isComplete()).isFalse();
        assertThat(first.consumed()).isEqualTo(3);
        assertThat(tokenizer.remainder()).isEqualTo("<foo bar=\"17\"");

        FragmentTokenizer.Scan second = tokenizer.feed(" />");
        assertThat(second.text()).isEqualTo("<foo bar=\"17\" />");
        assertThat(second.carriedLength()).isEqualTo(13);
        assertThat(second.isComplete()).isTrue();
        assertThat(tokenizer.hasRemainder()).isFalse();

        MarkupLexer.Token tag = second.tokens().get(0);
        assertThat(tag.type()).isEqualTo(TokenType.START_TAG);
        assertThat(tag.selfClosing()).isTrue();
        assertThat(tag.attributes()).containsEntry("bar", "17");
    }
}
