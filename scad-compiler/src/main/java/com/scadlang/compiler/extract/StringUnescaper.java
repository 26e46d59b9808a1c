package com.scadlang.compiler.extract;

import java.util.List;

/**
 * OpenSCAD 字符串转义处理
 *
 * <p>支持 {@code \" \\ \n \t \r \xHH \\uHHHH \UHHHHHH}；无法识别的转义原样保留。</p>
 */
public final class StringUnescaper {

    private StringUnescaper() {
    }

    /**
     * 去掉首尾引号（若存在）
     */
    public static String stripQuotes(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if ((first == '"' || first == '\'') && last == first) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    /**
     * 处理转义序列
     *
     * @param body    不含引号的字符串内容
     * @param invalid 收集无效转义序列的原文，可为 null
     */
    public static String unescape(String body, List<String> invalid) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case '"': sb.append('"'); i += 2; break;
                case '\'': sb.append('\''); i += 2; break;
                case '\\': sb.append('\\'); i += 2; break;
                case 'n': sb.append('\n'); i += 2; break;
                case 't': sb.append('\t'); i += 2; break;
                case 'r': sb.append('\r'); i += 2; break;
                case 'x':
                    i = appendCodePoint(body, i, 2, sb, invalid);
                    break;
                case 'u':
                    i = appendCodePoint(body, i, 4, sb, invalid);
                    break;
                case 'U':
                    i = appendCodePoint(body, i, 6, sb, invalid);
                    break;
                default:
                    sb.append(c).append(next);
                    if (invalid != null) invalid.add("\\" + next);
                    i += 2;
                    break;
            }
        }
        return sb.toString();
    }

    /**
     * 解析 \x / \\u / \U 后固定位数的十六进制码点，返回新的下标
     */
    private static int appendCodePoint(String body, int start, int digits, StringBuilder sb, List<String> invalid) {
        int end = start + 2 + digits;
        String hex = end <= body.length() ? body.substring(start + 2, end) : null;
        if (hex != null && isHex(hex)) {
            int codePoint = Integer.parseInt(hex, 16);
            if (codePoint > 0 && Character.isValidCodePoint(codePoint)) {
                sb.appendCodePoint(codePoint);
                return end;
            }
        }
        String raw = body.substring(start, Math.min(end, body.length()));
        sb.append(body, start, start + 2);
        if (invalid != null) invalid.add(raw);
        return start + 2;
    }

    private static boolean isHex(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
