package com.blockindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 通用分词器：连续的字母/数字（任意文字系统）组成词，其余非空白字符各自成为一个标点 token。
 *
 * 保留原文大小写，不做停用词过滤。
 */
public class SimpleTokenizer implements Tokenizer {

    /**
     * 对文本分词，按出现顺序返回。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }

            if (isWordCodePoint(codePoint)) {
                int wordStart = cursor;
                while (cursor < text.length() && isWordCodePoint(text.codePointAt(cursor))) {
                    cursor += Character.charCount(text.codePointAt(cursor));
                }
                tokens.add(new Token(text.substring(wordStart, cursor), false));
                continue;
            }

            int symbolEnd = cursor + Character.charCount(codePoint);
            tokens.add(new Token(text.substring(cursor, symbolEnd), true));
            cursor = symbolEnd;
        }

        return List.copyOf(tokens);
    }

    /**
     * 字母、数字以及依附于字母的组合记号都属于词的一部分。
     */
    private boolean isWordCodePoint(int codePoint) {
        if (Character.isLetterOrDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK;
    }
}
