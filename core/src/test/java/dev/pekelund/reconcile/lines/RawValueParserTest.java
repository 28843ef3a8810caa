package dev.pekelund.reconcile.lines;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RawValueParserTest {

    @Test
    void readsCurrencyAndThousandsSeparators() {
        assertThat(RawValueParser.parseDecimal("$1,234.50")).isEqualByComparingTo("1234.50");
        assertThat(RawValueParser.parseDecimal("1 234,50 €")).isEqualByComparingTo("1234.50");
        assertThat(RawValueParser.parseDecimal("1.234,50")).isEqualByComparingTo("1234.50");
        assertThat(RawValueParser.parseDecimal("1,234")).isEqualByComparingTo("1234");
    }

    @Test
    void readsDecimalComma() {
        assertThat(RawValueParser.parseDecimal("12,50")).isEqualByComparingTo("12.50");
    }

    @Test
    void readsNegativeNotations() {
        assertThat(RawValueParser.parseDecimal("(5.00)")).isEqualByComparingTo("-5.00");
        assertThat(RawValueParser.parseDecimal("-$5.00")).isEqualByComparingTo("-5.00");
        assertThat(RawValueParser.parseDecimal("5.00-")).isEqualByComparingTo("-5.00");
    }

    @Test
    void returnsNullForTextWithoutNumber() {
        assertThat(RawValueParser.parseDecimal("n/a")).isNull();
        assertThat(RawValueParser.parseDecimal("2.84 kg")).isNull();
        assertThat(RawValueParser.parseDecimal(null)).isNull();
    }

    @Test
    void splitsNumberFromUnit() {
        assertThat(RawValueParser.splitUnit("2.84 kg")).containsExactly("2.84", "kg");
        assertThat(RawValueParser.splitUnit("12lbs.")).containsExactly("12", "lbs");
        assertThat(RawValueParser.splitUnit("35.50")).isNull();
    }
}
