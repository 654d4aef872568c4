package com.alertmigrator.service.core.uid;

import java.security.SecureRandom;

/** 14 character identifiers: a leading letter followed by mixed-case alphanumerics. */
public class RandomShortUidGenerator implements ShortUidGenerator {

    static final int LENGTH = 14;
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String ALPHANUMERIC = LETTERS + "0123456789";

    private final SecureRandom random = new SecureRandom();

    @Override
    public String generate() {
        StringBuilder sb = new StringBuilder(LENGTH);
        sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
        for (int i = 1; i < LENGTH; i++) {
            sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
