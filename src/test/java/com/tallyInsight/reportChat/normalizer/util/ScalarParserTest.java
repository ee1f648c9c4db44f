package com.tallyInsight.reportChat.normalizer.util;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ScalarParserTest {

    @Nested
    class Parse {

        @Test
        void parse_shouldStripIndianThousandsSeparators() {
            assertThat(ScalarParser.parse("1,23,456.50")).isEqualTo(123456.5);
        }

        @Test
        void parse_shouldTreatDrAsPositiveAndCrAsNegative() {
            assertThat(ScalarParser.parse("1,200.00 Dr")).isEqualTo(1200.0);
            assertThat(ScalarParser.parse("1,200.00 Cr")).isEqualTo(-1200.0);
            assertThat(ScalarParser.parse("500 cr.")).isEqualTo(-500.0);
        }

        @Test
        void parse_shouldDropCurrencyMarkers() {
            assertThat(ScalarParser.parse("₹ 5,000")).isEqualTo(5000.0);
            assertThat(ScalarParser.parse("Rs. 750.25")).isEqualTo(750.25);
        }

        @Test
        void parse_shouldKeepLeadingMinus() {
            assertThat(ScalarParser.parse("-2,50,000.00")).isEqualTo(-250000.0);
        }

        @Test
        void parse_shouldAcceptNumbers() {
            assertThat(ScalarParser.parse(42)).isEqualTo(42.0);
            assertThat(ScalarParser.parse(new BigDecimal("10.5"))).isEqualTo(10.5);
        }

        @Test
        void parse_shouldReturnZeroForParsedZero() {
            assertThat(ScalarParser.parse("0.00")).isEqualTo(0.0);
        }

        @Test
        void parse_shouldApplyAccountingSuffixToTallyAmount() {
            assertThat(ScalarParser.parse("1,234.50 Cr")).isEqualTo(-1234.50);
            assertThat(ScalarParser.parse("1,234.50 Dr")).isEqualTo(1234.50);
            assertThat(ScalarParser.parse("1,234.50")).isEqualTo(1234.50);
        }

        @Test
        void parse_shouldTreatParenthesesAsNegative() {
            assertThat(ScalarParser.parse("(1,234.00)")).isEqualTo(-1234.0);
            assertThat(ScalarParser.parse("₹ (500)")).isEqualTo(-500.0);
        }

        @Test
        void parse_shouldReadScientificNotation() {
            assertThat(ScalarParser.parse("1.2345E7")).isEqualTo(1.2345E7);
            assertThat(ScalarParser.parse("-2.5E-3")).isEqualTo(-0.0025);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1,234.50 Cr", "1,23,45,000.00 Dr", "12,34,56,789.75", "-98,76,54,321.00", "0.00", "(2,00,00,000)"})
        void parse_shouldBeIdempotentOnItsOwnStringForm(String raw) {
            Double parsed = ScalarParser.parse(raw);

            assertThat(parsed).isNotNull();
            assertThat(ScalarParser.parse(String.valueOf(parsed))).isEqualTo(parsed);
        }

        @Test
        void parse_shouldRejectTextWithSeveralNumbers() {
            assertThat(ScalarParser.parse("17.22 : 1")).isNull();
            assertThat(ScalarParser.parse("01-Apr-2024")).isNull();
        }

        @Test
        void parse_shouldKeepSingleNumberBesideUnits() {
            assertThat(ScalarParser.parse("500.00/Nos")).isEqualTo(500.0);
            assertThat(ScalarParser.parse("- 1,200")).isEqualTo(-1200.0);
        }

        @Test
        void parse_shouldReturnNullForBlankOrTextOrNonScalar() {
            assertThat(ScalarParser.parse(null)).isNull();
            assertThat(ScalarParser.parse("")).isNull();
            assertThat(ScalarParser.parse("   ")).isNull();
            assertThat(ScalarParser.parse("Capital Account")).isNull();
            assertThat(ScalarParser.parse("-")).isNull();
            assertThat(ScalarParser.parse(java.util.Map.of("A", "1"))).isNull();
        }

        @Test
        void parse_shouldRejectNonFiniteNumbers() {
            assertThat(ScalarParser.parse(Double.NaN)).isNull();
            assertThat(ScalarParser.parse(Double.POSITIVE_INFINITY)).isNull();
        }
    }

    @Nested
    class ParseRatio {

        @Test
        void parseRatio_shouldKeepOnlyTheLeadingNumber() {
            assertThat(ScalarParser.parseRatio("17.22 : 1")).isEqualTo(17.22);
            assertThat(ScalarParser.parseRatio("120 Nos")).isEqualTo(120.0);
            assertThat(ScalarParser.parseRatio("0.00 days")).isEqualTo(0.0);
        }

        @Test
        void parseRatio_shouldHandleSeparatorsInsideTheRun() {
            assertThat(ScalarParser.parseRatio("1,250 Kgs")).isEqualTo(1250.0);
        }

        @Test
        void parseRatio_shouldReturnNullWithoutDigits() {
            assertThat(ScalarParser.parseRatio("Nos")).isNull();
            assertThat(ScalarParser.parseRatio(null)).isNull();
        }
    }
}
