package me.misix.bot.adapter.outbound.persistence;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StoragePathsTest {

    @Test
    void shouldKeepSafeIds() {
        assertEquals("user-1_A", StoragePaths.safeSegment("user-1_A"));
    }

    @Test
    void shouldReplaceUnsafeCharacters() {
        assertEquals("___etc_passwd", StoragePaths.safeSegment("../etc/passwd"));
    }

    @Test
    void shouldRejectBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> StoragePaths.safeSegment(" "));
        assertThrows(IllegalArgumentException.class, () -> StoragePaths.safeSegment(null));
    }
}
