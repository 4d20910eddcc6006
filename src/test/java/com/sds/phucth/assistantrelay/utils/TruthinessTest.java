package com.sds.phucth.assistantrelay.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TruthinessTest {

    @Test
    void falsyValues() {
        assertFalse(Truthiness.isTruthy(null));
        assertFalse(Truthiness.isTruthy(false));
        assertFalse(Truthiness.isTruthy(0));
        assertFalse(Truthiness.isTruthy(0.0));
        assertFalse(Truthiness.isTruthy(""));
        assertFalse(Truthiness.isTruthy(List.of()));
        assertFalse(Truthiness.isTruthy(Map.of()));
    }

    @Test
    void truthyValues() {
        assertTrue(Truthiness.isTruthy(true));
        assertTrue(Truthiness.isTruthy(1));
        assertTrue(Truthiness.isTruthy("no"));
        assertTrue(Truthiness.isTruthy(List.of("x")));
        assertTrue(Truthiness.isTruthy(new Object()));
    }
}
