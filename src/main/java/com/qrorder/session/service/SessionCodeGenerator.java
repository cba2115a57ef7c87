package com.qrorder.session.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Generates human-shareable session codes: {@code SO-<base36 epoch millis>-<4 chars>},
 * e.g. {@code SO-LXQ3K2ZB-7F2K}.
 */
@Component
public class SessionCodeGenerator {

    static final String PREFIX = "SO-";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 4;

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        return generate(System.currentTimeMillis());
    }

    String generate(long epochMillis) {
        StringBuilder code = new StringBuilder(PREFIX)
                .append(Long.toString(epochMillis, 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
