package com.nexuslog.sdk.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimestampTest {

    @Test
    void rejectsOutOfRangeNanos() {
        assertThrows(IllegalArgumentException.class, () -> new Timestamp(1, 1_000_000_000));
        assertThrows(IllegalArgumentException.class, () -> new Timestamp(1, -1));
    }

    @Test
    void plusNanosCarriesIntoSeconds() {
        Timestamp ts = new Timestamp(100, 900_000_000);
        assertEquals(new Timestamp(101, 100_000_000), ts.plusNanos(200_000_000));
        assertEquals(new Timestamp(102, 900_000_000), ts.plusNanos(2_000_000_000L));
        assertEquals(new Timestamp(100, 900_000_001), ts.plusNanos(1));
    }
}
