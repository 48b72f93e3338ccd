package io.sunplane.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

final class IdsTest {
    private static final Instant NOW = Instant.parse("2026-03-04T05:06:07Z");

    @Test
    void timestampedIdsHaveFixedShapeAndAvoidExisting() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String id = Ids.timestamped("tsk", NOW, seen);
            Assertions.assertTrue(id.matches("tsk-20260304-050607-[0-9a-z]{3}"), id);
            Assertions.assertTrue(seen.add(id), "duplicate " + id);
        }
    }

    @Test
    void lockTokenEmbedsUnixSecondsAndSixDigits() {
        Assertions.assertTrue(Ids.lockToken(NOW).matches("lock-" + NOW.getEpochSecond() + "-\\d{6}"));
    }

    @Test
    void base36SuffixIsZeroPadded() {
        Assertions.assertEquals("000", Ids.base36Suffix(0));
        Assertions.assertEquals("00z", Ids.base36Suffix(35));
        Assertions.assertEquals("zzz", Ids.base36Suffix(36 * 36 * 36 - 1));
    }
}
