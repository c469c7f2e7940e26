package com.urlshortener.domain.encoding;

/**
 * Turns an allocated counter value into a short code.
 *
 * <p>The id is multiplied by {@value #SALT_MULTIPLIER} and the salt added, so the salt only
 * occupies the low decimal digits: distinct ids always yield distinct codes regardless of salt.
 * The result is rendered in base 62 (digits, then upper case, then lower case, most significant
 * first) and left-padded with {@code '0'} to {@value #MIN_WIDTH} characters.
 *
 * <p>Pure and stateless.
 */
public final class ShortCodeEncoder {

    public static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
    public static final int BASE = ALPHABET.length();
    public static final int SALT_MULTIPLIER = 1000;
    public static final int MIN_WIDTH = 7;

    private ShortCodeEncoder() {}

    /**
     * @param id   allocator value, non-negative
     * @param salt value in {@code [0, 1000)}
     * @throws IllegalArgumentException if either argument is out of range
     * @throws ArithmeticException      if {@code id * 1000 + salt} overflows a long
     */
    public static String encode(long id, int salt) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        if (salt < 0 || salt >= SALT_MULTIPLIER) {
            throw new IllegalArgumentException("salt must be in [0, " + SALT_MULTIPLIER + "): " + salt);
        }
        long combined = Math.addExact(Math.multiplyExact(id, SALT_MULTIPLIER), salt);
        return padLeft(toBase62(combined));
    }

    /**
     * Renders a non-negative number in base 62 without padding; zero renders as {@code "0"}.
     */
    public static String toBase62(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative: " + number);
        }
        if (number == 0) {
            return "0";
        }
        StringBuilder builder = new StringBuilder();
        while (number > 0) {
            builder.append(ALPHABET.charAt((int) (number % BASE)));
            number /= BASE;
        }
        return builder.reverse().toString();
    }

    private static String padLeft(String digits) {
        if (digits.length() >= MIN_WIDTH) {
            return digits;
        }
        return "0".repeat(MIN_WIDTH - digits.length()) + digits;
    }
}
