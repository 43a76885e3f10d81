package com.blockindex.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分片编解码单元测试，覆盖 round-trip、字节布局与损坏检测。
 */
class ShardCodecTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 10, 1000})
    @DisplayName("随机分片round-trip")
    void testRandomShardRoundTrip(int entryCount) throws IOException {
        Shard shard = randomShard(new Random(entryCount + 17L), entryCount);

        byte[] encoded = ShardCodec.encode(shard);
        assertEquals(ShardCodec.encodedSize(shard), encoded.length);
        assertEquals(shard, ShardCodec.decode(encoded));
    }

    @Test
    @DisplayName("字节布局为大端定长int32与长度前缀")
    void testByteLayout() {
        Shard shard = new Shard(List.of(
            new IndexEntry(3, new int[] {7, 9}),
            new IndexEntry(5, new int[] {})
        ));

        ByteBuffer buffer = ByteBuffer.wrap(ShardCodec.encode(shard));
        assertEquals(4 + (8 + 8) + 8, buffer.remaining());
        assertEquals(2, buffer.getInt());
        assertEquals(3, buffer.getInt());
        assertEquals(2, buffer.getInt());
        assertEquals(7, buffer.getInt());
        assertEquals(9, buffer.getInt());
        assertEquals(5, buffer.getInt());
        assertEquals(0, buffer.getInt());
        assertFalse(buffer.hasRemaining());
    }

    @Test
    @DisplayName("文件写入读取一致")
    void testFileRoundTrip() throws IOException {
        Shard shard = randomShard(new Random(5), 50);
        Path file = tempDir.resolve("shard-0");

        ShardCodec.write(shard, file);

        assertEquals(ShardCodec.encodedSize(shard), Files.size(file));
        assertEquals(shard, ShardCodec.read(file));
    }

    @Test
    @DisplayName("截断数据应抛出CorruptShardException")
    void testTruncatedShardIsCorrupt() {
        byte[] encoded = ShardCodec.encode(randomShard(new Random(3), 20));

        for (int length : new int[] {0, 2, 4, 8, encoded.length - 4, encoded.length - 1}) {
            byte[] truncated = Arrays.copyOf(encoded, length);
            assertThrows(CorruptShardException.class, () -> ShardCodec.decode(truncated), "length=" + length);
        }
    }

    @Test
    void testDeclaredEntryCountLargerThanDataIsCorrupt() {
        byte[] bytes = ByteBuffer.allocate(4).putInt(Integer.MAX_VALUE).array();
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(bytes));
    }

    @Test
    void testNegativeCountsAreCorrupt() {
        byte[] negativeEntryCount = ByteBuffer.allocate(4).putInt(-1).array();
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(negativeEntryCount));

        byte[] negativePostingCount = ByteBuffer.allocate(12).putInt(1).putInt(0).putInt(-3).array();
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(negativePostingCount));
    }

    @Test
    void testDeclaredPostingCountLargerThanDataIsCorrupt() {
        byte[] bytes = ByteBuffer.allocate(16).putInt(1).putInt(0).putInt(5).putInt(42).array();
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(bytes));
    }

    @Test
    void testTrailingBytesAreCorrupt() {
        byte[] encoded = ShardCodec.encode(new Shard(List.of(new IndexEntry(1, new int[] {2}))));
        byte[] padded = Arrays.copyOf(encoded, encoded.length + 4);
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(padded));
    }

    @Test
    void testUnorderedTermIdsAreCorrupt() {
        byte[] bytes = ByteBuffer.allocate(4 + 8 + 8)
            .putInt(2)
            .putInt(9).putInt(0)
            .putInt(4).putInt(0)
            .array();
        assertThrows(CorruptShardException.class, () -> ShardCodec.decode(bytes));
    }

    @Test
    void testCorruptFileMessageNamesFile() throws IOException {
        Path file = tempDir.resolve("shard-3");
        Files.write(file, new byte[] {0, 0, 0, 9});

        CorruptShardException exception = assertThrows(CorruptShardException.class, () -> ShardCodec.read(file));
        assertTrue(exception.getMessage().contains("shard-3"));
    }

    @Test
    void testMissingFileIsIoFailure() {
        assertThrows(IOException.class, () -> ShardCodec.read(tempDir.resolve("missing")));
    }

    /**
     * 生成满足分片不变量的随机分片：termId 严格递增，文档 ID 非负。
     */
    static Shard randomShard(Random random, int entryCount) {
        List<IndexEntry> entries = new ArrayList<>(entryCount);
        int termId = random.nextInt(5);
        for (int index = 0; index < entryCount; index++) {
            int[] docIds = new int[random.nextInt(8)];
            for (int docIndex = 0; docIndex < docIds.length; docIndex++) {
                docIds[docIndex] = random.nextInt(10_000);
            }
            entries.add(new IndexEntry(termId, docIds));
            termId += random.nextInt(3) + 1;
        }
        return new Shard(entries);
    }
}
