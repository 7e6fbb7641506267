package com.bbthechange.podfeed.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates the short public identifiers feeds are addressed by.
 */
public final class FeedIdGenerator {

    private static final String CHARACTERS = "abcdefghijkmnpqrstuvwxyz23456789";
    private static final int ID_LENGTH = 10;
    private static final SecureRandom random = new SecureRandom();

    private FeedIdGenerator() {
    }

    /**
     * Format: 10 lowercase characters without the look-alikes l, o, 0 and 1 (e.g. "k3xq7b9mza").
     */
    public static String generate() {
        StringBuilder id = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            id.append(CHARACTERS.charAt(random.nextInt(CHARACTERS.length())));
        }
        return id.toString();
    }

    /**
     * Keeps generating until existsChecker reports an unused id.
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        String id;
        do {
            id = generate();
        } while (existsChecker.test(id));
        return id;
    }
}
