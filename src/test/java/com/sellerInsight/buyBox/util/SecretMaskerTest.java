package com.sellerInsight.buyBox.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SecretMaskerTest {
    
    @Test
    @DisplayName("Keeps the first four and last two characters of long secrets")
    void masksMiddle() {
        assertThat(SecretMasker.mask("Atza|IwEBIexampleXy")).isEqualTo("Atza****Xy");
    }
    
    @Test
    @DisplayName("Short or missing secrets are fully masked")
    void masksShortSecrets() {
        assertThat(SecretMasker.mask("12345678")).isEqualTo("****");
        assertThat(SecretMasker.mask(null)).isEqualTo("****");
    }
}
