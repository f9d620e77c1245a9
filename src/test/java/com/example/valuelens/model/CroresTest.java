package com.example.valuelens.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CroresTest {

    @Test
    @DisplayName("market cap above one million is treated as rupees and converted")
    void marketCapInRupees() {
        assertThat(Crores.fromMarketCap(new BigDecimal("5000000000"))).isEqualByComparingTo("500");
    }

    @Test
    @DisplayName("market cap at or below one million is taken as already in crores")
    void marketCapAlreadyInCrores() {
        assertThat(Crores.fromMarketCap(new BigDecimal("500"))).isEqualByComparingTo("500");
        assertThat(Crores.fromMarketCap(new BigDecimal("1000000"))).isEqualByComparingTo("1000000");
    }

    @Test
    void marketCapMissing() {
        assertThat(Crores.fromMarketCap(null)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void of_roundsToScale() {
        assertThat(Crores.of(new BigDecimal("2254580000000"), 2)).isEqualByComparingTo("225458.00");
        assertThat(Crores.of(new BigDecimal("123456789"), 2)).isEqualByComparingTo("12.35");
        assertThat(Crores.of(null, 2)).isEqualByComparingTo("0");
    }
}
