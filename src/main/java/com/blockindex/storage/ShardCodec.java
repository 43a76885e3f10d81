package com.blockindex.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 分片二进制编解码器
 *
 * 文件格式（大端定长 int32，长度前缀，无分隔符）：
 * <pre>
 * Shard := entryCount:int32, Entry{entryCount}
 * Entry := termId:int32, postingCount:int32, docId:int32{postingCount}
 * </pre>
 * 块分片与最终索引分片共用此格式。
 */
public final class ShardCodec {
    private static final int ENTRY_HEADER_BYTES = 2 * Integer.BYTES;

    private ShardCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 计算分片编码后的字节数。
     *
     * @param shard 分片
     * @return 字节数
     */
    public static int encodedSize(Shard shard) {
        long size = Integer.BYTES;
        for (IndexEntry entry : shard.entries()) {
            size += ENTRY_HEADER_BYTES + (long) entry.postingCount() * Integer.BYTES;
        }
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("分片过大，无法编码: " + size + " bytes");
        }
        return (int) size;
    }

    /**
     * 将分片编码为字节数组。
     *
     * @param shard 分片
     * @return 编码结果
     */
    public static byte[] encode(Shard shard) {
        if (shard == null) {
            throw new IllegalArgumentException("分片不能为null");
        }
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(shard));
        buffer.putInt(shard.size());
        for (IndexEntry entry : shard.entries()) {
            buffer.putInt(entry.termId());
            buffer.putInt(entry.postingCount());
            for (int index = 0; index < entry.postingCount(); index++) {
                buffer.putInt(entry.docId(index));
            }
        }
        return buffer.array();
    }

    /**
     * 从字节数组解码分片，任何计数与剩余字节不符都视为损坏。
     *
     * @param bytes 编码数据
     * @return 解码后的分片
     * @throws CorruptShardException 计数非法、数据截断、存在多余字节或词条无序时抛出
     */
    public static Shard decode(byte[] bytes) throws CorruptShardException {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        if (buffer.remaining() < Integer.BYTES) {
            throw new CorruptShardException("分片缺少entryCount，length=" + bytes.length);
        }

        int entryCount = buffer.getInt();
        if (entryCount < 0) {
            throw new CorruptShardException("entryCount非法: " + entryCount);
        }
        if ((long) entryCount * ENTRY_HEADER_BYTES > buffer.remaining()) {
            throw new CorruptShardException("entryCount超出可用字节: entryCount=" + entryCount
                + ", remaining=" + buffer.remaining());
        }

        List<IndexEntry> entries = new ArrayList<>(entryCount);
        int previousTermId = -1;
        for (int entryIndex = 0; entryIndex < entryCount; entryIndex++) {
            if (buffer.remaining() < ENTRY_HEADER_BYTES) {
                throw new CorruptShardException("词条头部被截断: entry=" + entryIndex);
            }
            int termId = buffer.getInt();
            int postingCount = buffer.getInt();
            if (termId < 0 || termId <= previousTermId) {
                throw new CorruptShardException("termId非法或未严格递增: entry=" + entryIndex
                    + ", termId=" + termId + ", previous=" + previousTermId);
            }
            if (postingCount < 0) {
                throw new CorruptShardException("postingCount非法: entry=" + entryIndex + ", postingCount=" + postingCount);
            }
            if ((long) postingCount * Integer.BYTES > buffer.remaining()) {
                throw new CorruptShardException("postingCount超出可用字节: entry=" + entryIndex
                    + ", postingCount=" + postingCount + ", remaining=" + buffer.remaining());
            }

            int[] docIds = new int[postingCount];
            for (int index = 0; index < postingCount; index++) {
                docIds[index] = buffer.getInt();
                if (docIds[index] < 0) {
                    throw new CorruptShardException("docId非法: entry=" + entryIndex + ", value=" + docIds[index]);
                }
            }
            entries.add(new IndexEntry(termId, docIds));
            previousTermId = termId;
        }

        if (buffer.hasRemaining()) {
            throw new CorruptShardException("分片包含未解析字节: " + buffer.remaining());
        }
        return new Shard(entries);
    }

    /**
     * 编码并写入分片文件，已存在的文件会被覆盖。
     *
     * @param shard 分片
     * @param file 目标文件
     * @throws IOException 写入失败时抛出
     */
    public static void write(Shard shard, Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分片文件不能为空");
        }
        Files.write(file, encode(shard),
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /**
     * 读取并解码分片文件。
     *
     * @param file 分片文件
     * @return 解码后的分片
     * @throws CorruptShardException 文件内容损坏时抛出
     * @throws IOException 读取失败时抛出
     */
    public static Shard read(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分片文件不能为空");
        }
        byte[] bytes = Files.readAllBytes(file);
        try {
            return decode(bytes);
        } catch (CorruptShardException exception) {
            throw new CorruptShardException("分片文件损坏: " + file + " - " + exception.getMessage(), exception);
        }
    }
}
