package com.blockindex.storage;

import java.io.IOException;

/**
 * 分片解码时声明的计数与实际字节不符。
 */
public class CorruptShardException extends IOException {

    public CorruptShardException(String message) {
        super(message);
    }

    public CorruptShardException(String message, Throwable cause) {
        super(message, cause);
    }
}
