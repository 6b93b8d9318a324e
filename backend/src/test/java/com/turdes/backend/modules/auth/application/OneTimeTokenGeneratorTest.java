package com.turdes.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class OneTimeTokenGeneratorTest {

    private final OneTimeTokenGenerator generator = new OneTimeTokenGenerator();

    @Test
    void generatesHexEncodedThirtyTwoByteTokens() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            tokens.add(generator.generate());
        }

        assertThat(tokens).hasSize(50);
        assertThat(tokens).allSatisfy(token -> assertThat(token).hasSize(64).matches("[0-9a-f]{64}"));
    }

    @Test
    void hashesWithSha256() {
        assertThat(generator.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void nullNeverMatches() {
        assertThat(generator.matches("token", "token")).isTrue();
        assertThat(generator.matches("token", "token2")).isFalse();
        assertThat(generator.matches(null, "token")).isFalse();
        assertThat(generator.matches("token", null)).isFalse();
        assertThat(generator.matches(null, null)).isFalse();
    }
}
