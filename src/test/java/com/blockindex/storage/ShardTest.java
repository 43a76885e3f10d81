package com.blockindex.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ShardTest {

    @Test
    void testEntryDefensiveCopy() {
        int[] docIds = new int[] {1, 2};
        IndexEntry entry = new IndexEntry(4, docIds);

        docIds[0] = 99;
        assertArrayEquals(new int[] {1, 2}, entry.docIds());

        int[] returned = entry.docIds();
        returned[1] = 77;
        assertArrayEquals(new int[] {1, 2}, entry.docIds());
        assertEquals(2, entry.postingCount());
        assertEquals(2, entry.docId(1));
    }

    @Test
    void testEntryEqualityUsesArrayContent() {
        assertEquals(new IndexEntry(1, new int[] {3, 4}), new IndexEntry(1, new int[] {3, 4}));
        assertEquals(new IndexEntry(1, new int[] {3, 4}).hashCode(), new IndexEntry(1, new int[] {3, 4}).hashCode());
        assertNotEquals(new IndexEntry(1, new int[] {3, 4}), new IndexEntry(1, new int[] {4, 3}));
        assertNotEquals(new IndexEntry(1, new int[] {3}), new IndexEntry(2, new int[] {3}));
    }

    @Test
    void testEntryRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new IndexEntry(-1, new int[] {}));
        assertThrows(IllegalArgumentException.class, () -> new IndexEntry(0, null));
        assertThrows(IllegalArgumentException.class, () -> new IndexEntry(0, new int[] {-5}));
    }

    @Test
    void testShardRequiresStrictlyIncreasingTermIds() {
        assertThrows(IllegalArgumentException.class, () -> new Shard(List.of(
            new IndexEntry(2, new int[] {0}),
            new IndexEntry(2, new int[] {1}))));
        assertThrows(IllegalArgumentException.class, () -> new Shard(List.of(
            new IndexEntry(3, new int[] {0}),
            new IndexEntry(1, new int[] {1}))));
    }

    @Test
    void testShardCopiesEntries() {
        List<IndexEntry> entries = new ArrayList<>();
        entries.add(new IndexEntry(1, new int[] {0}));
        Shard shard = new Shard(entries);

        entries.add(new IndexEntry(2, new int[] {0}));
        assertEquals(1, shard.size());
        assertEquals(1, shard.firstTermId());
        assertEquals(1, shard.lastTermId());
    }

    @Test
    void testEmptyShard() {
        Shard shard = new Shard(List.of());
        assertTrue(shard.isEmpty());
        assertThrows(IllegalStateException.class, shard::firstTermId);
        assertThrows(IllegalStateException.class, shard::lastTermId);
    }
}
