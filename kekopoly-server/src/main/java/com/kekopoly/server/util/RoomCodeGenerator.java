package com.kekopoly.server.util;

import java.security.SecureRandom;

/** Six-character room codes without the easily confused 0/O and 1/I. */
public class RoomCodeGenerator {

    public static final String CHARSET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            out[i] = CHARSET.charAt(random.nextInt(CHARSET.length()));
        }
        return new String(out);
    }

    public static boolean looksLikeCode(String value) {
        if (value == null || value.length() != LENGTH) return false;
        String upper = value.toUpperCase();
        for (int i = 0; i < upper.length(); i++) {
            if (CHARSET.indexOf(upper.charAt(i)) < 0) return false;
        }
        return true;
    }
}
