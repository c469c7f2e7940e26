package com.urlshortener.infrastructure.id;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomSaltGeneratorTest {

    private final RandomSaltGenerator generator = new RandomSaltGenerator();

    @Test
    void shouldStayWithinRange() {
        for (int i = 0; i < 10_000; i++) {
            int salt = generator.nextSalt();
            assertTrue(salt >= 0 && salt < 1000, "salt out of range: " + salt);
        }
    }

    @Test
    void shouldVaryBetweenCalls() {
        Set<Integer> salts = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            salts.add(generator.nextSalt());
        }
        assertTrue(salts.size() > 100, "Salts should not repeat a handful of values");
    }
}
