package com.blockindex.text;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 按 UTF-8 直接读取纯文本文件。
 */
public class PlainTextExtractor implements TextExtractor {

    @Override
    public String extract(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("文件路径不能为空");
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
