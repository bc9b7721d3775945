package com.raditha.luakit.lexer;

import org.jspecify.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Reads and writes Lua string literals.
 * <p>
 * Lua strings are byte strings. A literal is decoded into the bytes it denotes
 * (raw source characters contribute their UTF-8 encoding) and rendered back as
 * a quoted literal that escapes only what Lua requires: the quote, the
 * backslash, control bytes and bytes that are not part of a valid UTF-8
 * sequence.
 */
public final class LuaStrings {

    private static final Pattern NUMERIC_ESCAPE = Pattern.compile("\\\\(x[0-9A-Fa-f]{2}|\\d|u\\{[0-9A-Fa-f]+})");

    private LuaStrings() {
    }

    public static boolean isQuoted(String lexeme) {
        return lexeme.length() >= 2
                && (lexeme.charAt(0) == '"' || lexeme.charAt(0) == '\'')
                && lexeme.charAt(lexeme.length() - 1) == lexeme.charAt(0);
    }

    public static boolean isLongBracket(String lexeme) {
        return LuaLexer.longBracketLevel(lexeme, 0) >= 0;
    }

    /**
     * True when a literal contains a hex, decimal or unicode escape.
     */
    public static boolean hasNumericEscape(String lexeme) {
        return isQuoted(lexeme) && NUMERIC_ESCAPE.matcher(lexeme).find();
    }

    /**
     * Bytes denoted by a string literal.
     *
     * @param lexeme a quoted or long-bracket literal, delimiters included
     * @return the bytes, or null if the literal is malformed or unterminated
     */
    public static byte @Nullable [] decode(String lexeme) {
        if (isLongBracket(lexeme)) {
            return decodeLongBracket(lexeme);
        }
        if (!isQuoted(lexeme)) {
            return null;
        }
        return decodeQuoted(lexeme);
    }

    /**
     * Text denoted by a string literal, read as UTF-8.
     */
    public static @Nullable String decodeToText(String lexeme) {
        byte[] bytes = decode(lexeme);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte @Nullable [] decodeLongBracket(String lexeme) {
        int level = LuaLexer.longBracketLevel(lexeme, 0);
        String closer = "]" + "=".repeat(level) + "]";
        int bodyStart = level + 2;
        if (lexeme.length() < bodyStart + closer.length() || !lexeme.endsWith(closer)) {
            return null;
        }
        String body = lexeme.substring(bodyStart, lexeme.length() - closer.length());
        if (body.contains(closer)) {
            return null;
        }
        if (body.startsWith("\r\n")) {
            body = body.substring(2);
        } else if (body.startsWith("\n")) {
            body = body.substring(1);
        }
        return body.getBytes(StandardCharsets.UTF_8);
    }

    private static byte @Nullable [] decodeQuoted(String lexeme) {
        char quote = lexeme.charAt(0);
        int end = lexeme.length() - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 1;
        while (i < end) {
            char c = lexeme.charAt(i);
            if (c == quote || c == '\n') {
                return null;
            }
            if (c != '\\') {
                int cp = lexeme.codePointAt(i);
                if (Character.isSurrogate(c) && Character.charCount(cp) == 1) {
                    return null;
                }
                writeUtf8(out, cp);
                i += Character.charCount(cp);
                continue;
            }
            if (i + 1 >= end) {
                return null;
            }
            i = decodeEscape(lexeme, i + 1, end, out);
            if (i < 0) {
                return null;
            }
        }
        return i == end ? out.toByteArray() : null;
    }

    /**
     * Decode one escape whose selector character is at {@code i}.
     *
     * @return index after the escape, or -1 when it is malformed
     */
    private static int decodeEscape(String s, int i, int end, ByteArrayOutputStream out) {
        char e = s.charAt(i);
        switch (e) {
            case 'n' -> out.write('\n');
            case 't' -> out.write('\t');
            case 'r' -> out.write('\r');
            case 'a' -> out.write(7);
            case 'b' -> out.write(8);
            case 'f' -> out.write(12);
            case 'v' -> out.write(11);
            case '\\', '"', '\'' -> out.write(e);
            case '\n' -> out.write('\n');
            case '\r' -> {
                out.write('\n');
                return i + 1 < end && s.charAt(i + 1) == '\n' ? i + 2 : i + 1;
            }
            case 'x' -> {
                if (i + 2 >= end || !LuaLexer.isHexDigit(s.charAt(i + 1)) || !LuaLexer.isHexDigit(s.charAt(i + 2))) {
                    return -1;
                }
                out.write(Integer.parseInt(s.substring(i + 1, i + 3), 16));
                return i + 3;
            }
            case 'z' -> {
                int j = i + 1;
                while (j < end && Character.isWhitespace(s.charAt(j))) {
                    j++;
                }
                return j;
            }
            case 'u' -> {
                return decodeUnicodeEscape(s, i, end, out);
            }
            default -> {
                if (!LuaLexer.isDigit(e)) {
                    return -1;
                }
                int j = i;
                while (j < end && j < i + 3 && LuaLexer.isDigit(s.charAt(j))) {
                    j++;
                }
                int value = Integer.parseInt(s.substring(i, j));
                if (value > 255) {
                    return -1;
                }
                out.write(value);
                return j;
            }
        }
        return i + 1;
    }

    private static int decodeUnicodeEscape(String s, int i, int end, ByteArrayOutputStream out) {
        if (i + 1 >= end || s.charAt(i + 1) != '{') {
            return -1;
        }
        int close = s.indexOf('}', i + 2);
        if (close < 0 || close >= end || close == i + 2 || close - (i + 2) > 8) {
            return -1;
        }
        String hex = s.substring(i + 2, close);
        for (int k = 0; k < hex.length(); k++) {
            if (!LuaLexer.isHexDigit(hex.charAt(k))) {
                return -1;
            }
        }
        long cp = Long.parseLong(hex, 16);
        if (cp > Character.MAX_CODE_POINT) {
            return -1;
        }
        writeUtf8(out, (int) cp);
        return close + 1;
    }

    /**
     * UTF-8 bytes of a code point. Surrogate code points are encoded the way
     * Lua's {@code \\u{...}} escape does, as three-byte sequences.
     */
    private static void writeUtf8(ByteArrayOutputStream out, int cp) {
        if (cp < 0x80) {
            out.write(cp);
        } else if (cp < 0x800) {
            out.write(0xC0 | (cp >> 6));
            out.write(0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            out.write(0xE0 | (cp >> 12));
            out.write(0x80 | ((cp >> 6) & 0x3F));
            out.write(0x80 | (cp & 0x3F));
        } else {
            out.write(0xF0 | (cp >> 18));
            out.write(0x80 | ((cp >> 12) & 0x3F));
            out.write(0x80 | ((cp >> 6) & 0x3F));
            out.write(0x80 | (cp & 0x3F));
        }
    }

    /**
     * Render bytes as a quoted Lua literal.
     *
     * @param bytes the string value
     * @param quote {@code '"'} or {@code '\''}
     */
    public static String quote(byte[] bytes, char quote) {
        StringBuilder sb = new StringBuilder(bytes.length + 2);
        sb.append(quote);
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i] & 0xFF;
            if (b < 0x80) {
                appendAscii(sb, b, quote, nextIsDigit(bytes, i + 1));
                i++;
                continue;
            }
            int length = utf8SequenceLength(bytes, i);
            if (length > 0) {
                int cp = new String(bytes, i, length, StandardCharsets.UTF_8).codePointAt(0);
                if (cp >= 0xA0) {
                    sb.appendCodePoint(cp);
                    i += length;
                    continue;
                }
            }
            appendDecimal(sb, b, nextIsDigit(bytes, i + 1));
            i++;
        }
        sb.append(quote);
        return sb.toString();
    }

    public static String quote(String text, char quote) {
        return quote(text.getBytes(StandardCharsets.UTF_8), quote);
    }

    /**
     * Render bytes as a double-quoted literal made only of decimal escapes,
     * e.g. {@code "\104\105"} for {@code hi}.
     */
    public static String encodeDecimal(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 4 + 2);
        sb.append('"');
        for (byte b : bytes) {
            sb.append('\\').append(b & 0xFF);
        }
        return sb.append('"').toString();
    }

    private static boolean nextIsDigit(byte[] bytes, int i) {
        return i < bytes.length && bytes[i] >= '0' && bytes[i] <= '9';
    }

    private static void appendAscii(StringBuilder sb, int b, char quote, boolean digitFollows) {
        switch (b) {
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case 7 -> sb.append("\\a");
            case 8 -> sb.append("\\b");
            case 11 -> sb.append("\\v");
            case 12 -> sb.append("\\f");
            default -> {
                if (b == quote) {
                    sb.append('\\').append(quote);
                } else if (b < 0x20 || b == 0x7F) {
                    appendDecimal(sb, b, digitFollows);
                } else {
                    sb.append((char) b);
                }
            }
        }
    }

    private static void appendDecimal(StringBuilder sb, int b, boolean digitFollows) {
        sb.append('\\');
        String digits = Integer.toString(b);
        if (digitFollows) {
            digits = "0".repeat(3 - digits.length()) + digits;
        }
        sb.append(digits);
    }

    /**
     * Length of a well-formed UTF-8 sequence starting at {@code i}, or 0.
     */
    private static int utf8SequenceLength(byte[] bytes, int i) {
        int lead = bytes[i] & 0xFF;
        int length;
        int min;
        if (lead >= 0xC2 && lead <= 0xDF) {
            length = 2;
            min = 0x80;
        } else if (lead >= 0xE0 && lead <= 0xEF) {
            length = 3;
            min = 0x800;
        } else if (lead >= 0xF0 && lead <= 0xF4) {
            length = 4;
            min = 0x10000;
        } else {
            return 0;
        }
        if (i + length > bytes.length) {
            return 0;
        }
        int cp = lead & (0xFF >> (length + 1));
        for (int k = 1; k < length; k++) {
            int b = bytes[i + k] & 0xFF;
            if ((b & 0xC0) != 0x80) {
                return 0;
            }
            cp = (cp << 6) | (b & 0x3F);
        }
        if (cp < min || cp > Character.MAX_CODE_POINT || (cp >= 0xD800 && cp <= 0xDFFF)) {
            return 0;
        }
        return length;
    }
}
