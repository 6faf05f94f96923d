package com.example.AlignAi.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Sha256Test {

    @Test
    void hashesUtf8Text() {
        assertThat(Sha256.hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void emptyInputMapsToEmptySentinel() {
        assertThat(Sha256.hex("")).isEmpty();
        assertThat(Sha256.hex(null)).isEmpty();
    }
}
