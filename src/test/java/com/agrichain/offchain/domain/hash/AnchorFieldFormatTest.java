package com.agrichain.offchain.domain.hash;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AnchorFieldFormatTest {

    @Test
    void decimalDropsIntegralFraction() {
        assertThat(AnchorFieldFormat.decimal(100.0)).isEqualTo("100");
        assertThat(AnchorFieldFormat.decimal(12.5)).isEqualTo("12.5");
        assertThat(AnchorFieldFormat.decimal(0.1)).isEqualTo("0.1");
        assertThat(AnchorFieldFormat.decimal(-3.0)).isEqualTo("-3");
        assertThat(AnchorFieldFormat.decimal(1e20)).isEqualTo("100000000000000000000");
        assertThat(AnchorFieldFormat.decimal(0.0)).isEqualTo("0");
    }

    @Test
    void largeDecimalsUseTheShortestDigitsThatRoundTrip() {
        assertThat(AnchorFieldFormat.decimal(1e23)).isEqualTo("100000000000000000000000");
        assertThat(AnchorFieldFormat.decimal(8.41e21)).isEqualTo("8410000000000000000000");
        assertThat(AnchorFieldFormat.decimal(5e22)).isEqualTo("50000000000000000000000");
        assertThat(AnchorFieldFormat.debugDecimal(1e23)).isEqualTo("1e23");
        assertThat(AnchorFieldFormat.decimal(0.30000000000000004)).isEqualTo("0.30000000000000004");
    }

    @Test
    void debugDecimalAlwaysShowsFraction() {
        assertThat(AnchorFieldFormat.debugDecimal(22.0)).isEqualTo("22.0");
        assertThat(AnchorFieldFormat.debugDecimal(65.5)).isEqualTo("65.5");
        assertThat(AnchorFieldFormat.debugDecimal(0.0)).isEqualTo("0.0");
    }

    @Test
    void debugDecimalSwitchesToExponentAtTheEdges() {
        assertThat(AnchorFieldFormat.debugDecimal(1e16)).isEqualTo("1e16");
        assertThat(AnchorFieldFormat.debugDecimal(1.5e-5)).isEqualTo("1.5e-5");
        assertThat(AnchorFieldFormat.debugDecimal(1e15)).isEqualTo("1000000000000000.0");
        assertThat(AnchorFieldFormat.debugDecimal(0.0001)).isEqualTo("0.0001");
    }

    @Test
    void optionalDecimal() {
        assertThat(AnchorFieldFormat.optionalDecimal(22.0)).isEqualTo("Some(22.0)");
        assertThat(AnchorFieldFormat.optionalDecimal(null)).isEqualTo("None");
    }

    @Test
    void timestampPrintsOnlyTheNeededFraction() {
        assertThat(AnchorFieldFormat.timestamp(Instant.parse("2024-03-01T10:15:30Z")))
                .isEqualTo("2024-03-01 10:15:30 UTC");
        assertThat(AnchorFieldFormat.timestamp(Instant.parse("2024-03-01T10:15:30.120Z")))
                .isEqualTo("2024-03-01 10:15:30.120 UTC");
        assertThat(AnchorFieldFormat.timestamp(Instant.parse("2024-03-01T10:15:30.123456Z")))
                .isEqualTo("2024-03-01 10:15:30.123456 UTC");
        assertThat(AnchorFieldFormat.timestamp(Instant.parse("2024-03-01T10:15:30.123456789Z")))
                .isEqualTo("2024-03-01 10:15:30.123456789 UTC");
    }
}
