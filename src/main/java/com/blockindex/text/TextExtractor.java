package com.blockindex.text;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 文档格式转换服务：把源文件转换为纯文本。
 */
public interface TextExtractor {

    /**
     * 提取文件的纯文本内容。
     *
     * @param path 源文件
     * @return 纯文本
     * @throws IOException 读取或转换失败时抛出
     */
    String extract(Path path) throws IOException;
}
