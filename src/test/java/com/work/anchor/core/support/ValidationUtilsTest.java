package com.work.anchor.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationUtilsTest {

    @Test
    public void address_must_be_20_bytes_hex() {
        assertEquals("0x00000000000000000000000000000000000a11ce",
                ValidationUtils.requireValidAddress("0x00000000000000000000000000000000000a11ce", "address"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requireValidAddress("0x1234", "address"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requireValidAddress(" ", "address"));
    }

    @Test
    public void durations() {
        assertEquals(Duration.ZERO, ValidationUtils.requireNonNegative(Duration.ZERO, "d"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requirePositive(Duration.ZERO, "d"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requireNonNegative(Duration.ofSeconds(-1), "d"));
    }
}
