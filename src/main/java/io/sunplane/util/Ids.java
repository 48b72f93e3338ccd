package io.sunplane.util;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int SUFFIX_SPACE = 36 * 36 * 36;
    private static final int MAX_COLLISION_RETRIES = 128;

    private Ids() {
    }

    /**
     * {@code <prefix>-<yyyyMMdd-HHmmss>-<3 base36 chars>}, avoiding every id in {@code existing}.
     */
    public static String timestamped(String prefix, Instant now, Collection<String> existing) {
        String head = prefix + "-" + Timestamps.compact(now);
        Set<String> used = new HashSet<>();
        if (existing != null) {
            for (String id : existing) {
                if (id != null) {
                    used.add(id.trim());
                }
            }
        }
        for (int i = 0; i < MAX_COLLISION_RETRIES; i++) {
            String id = (head + "-" + base36Suffix(RANDOM.nextInt(SUFFIX_SPACE))).toLowerCase(Locale.ROOT);
            if (!used.contains(id)) {
                return id;
            }
        }
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        return (head + "-" + nanos).toLowerCase(Locale.ROOT);
    }

    public static String lockToken(Instant now) {
        return String.format(Locale.ROOT, "lock-%d-%06d", now.getEpochSecond(), RANDOM.nextInt(1_000_000));
    }

    static String base36Suffix(int value) {
        String suffix = Integer.toString(value, 36).toLowerCase(Locale.ROOT);
        while (suffix.length() < 3) {
            suffix = "0" + suffix;
        }
        return suffix;
    }
}
