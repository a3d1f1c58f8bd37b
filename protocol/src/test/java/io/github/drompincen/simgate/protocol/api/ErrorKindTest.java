package io.github.drompincen.simgate.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void allErrorKindsExist() {
        assertThat(ErrorKind.values()).containsExactly(
                ErrorKind.NOT_FOUND,
                ErrorKind.PRECONDITION_FAILED,
                ErrorKind.ENGINE_FAILURE,
                ErrorKind.INVALID_INPUT);
    }

    @Test
    void valueOfReturnsCorrectEnum() {
        assertThat(ErrorKind.valueOf("NOT_FOUND")).isEqualTo(ErrorKind.NOT_FOUND);
    }
}
