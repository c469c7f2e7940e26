package com.urlshortener.domain.model;

import com.urlshortener.domain.error.ValidationError.ShortCodeError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShortCodeTest {

    @Test
    void parseShouldSucceedWithCode() {
        var result = ShortCode.parse("3p0TyGVe");
        assertTrue(result.isSuccess());
        assertEquals("3p0TyGVe", result.getOrThrow().value());
    }

    @Test
    void parseShouldAcceptCodesOutsideTheAlphabet() {
        // unknown rather than invalid: resolves to not-found downstream
        assertTrue(ShortCode.parse("does-not-exist").isSuccess());
    }

    @Test
    void parseShouldFailWithNullValue() {
        var result = ShortCode.parse(null);
        assertTrue(result.isFailure());
        assertInstanceOf(ShortCodeError.Empty.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithBlankValue() {
        var result = ShortCode.parse(" ");
        assertTrue(result.isFailure());
        assertInstanceOf(ShortCodeError.Empty.class, result.errorOrNull());
    }

    @Test
    void shouldBeEqualForSameValue() {
        assertEquals(ShortCode.fromTrusted("abc"), ShortCode.parse("abc").getOrThrow());
    }

    @Test
    void constructorShouldRejectNull() {
        assertThrows(IllegalStateException.class, () -> new ShortCode(null));
    }
}
