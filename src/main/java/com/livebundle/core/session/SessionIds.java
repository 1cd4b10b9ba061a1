package com.livebundle.core.session;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Generation and validation of session identifiers of the form
 * {@code session-<epochMillis>-<suffix>}.
 */
public final class SessionIds {

    public static final String PREFIX = "session-";

    static final Pattern VALID_ID = Pattern.compile("^session-(\\d+)-[a-z0-9]+$");

    private static final int SUFFIX_LENGTH = 9;
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private SessionIds() {}

    public static String generate() {
        var random = ThreadLocalRandom.current();
        var suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return PREFIX + System.currentTimeMillis() + "-" + suffix;
    }

    public static boolean isValid(String sessionId) {
        return sessionId != null && VALID_ID.matcher(sessionId).matches();
    }

    /**
     * Extracts the creation time encoded in the id, if the id is well formed.
     */
    public static Optional<Instant> creationTime(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        var matcher = VALID_ID.matcher(sessionId);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(matcher.group(1))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
