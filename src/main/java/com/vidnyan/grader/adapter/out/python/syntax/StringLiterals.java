package com.vidnyan.grader.adapter.out.python.syntax;

import com.vidnyan.grader.application.port.out.SourceSyntaxException;

import java.util.Locale;

/**
 * Decodes string and bytes literals, and the literal pieces of f-strings, into their values.
 */
final class StringLiterals {

    private StringLiterals() {
    }

    static String decode(String literal, String origin, int line) {
        int quoteAt = 0;
        while (literal.charAt(quoteAt) != '\'' && literal.charAt(quoteAt) != '"') {
            quoteAt++;
        }
        String prefix = literal.substring(0, quoteAt).toLowerCase(Locale.ROOT);
        boolean raw = prefix.contains("r");
        boolean bytes = prefix.contains("b");

        String rest = literal.substring(quoteAt);
        int quoteLength = rest.length() >= 6 && (rest.startsWith("'''") || rest.startsWith("\"\"\"")) ? 3 : 1;
        String body = rest.substring(quoteLength, rest.length() - quoteLength);

        if (bytes) {
            for (int i = 0; i < body.length(); i++) {
                if (body.charAt(i) > 0x7f) {
                    throw new SourceSyntaxException(origin, line, "bytes can only contain ASCII literal characters");
                }
            }
        }
        if (raw) {
            return body;
        }
        return unescape(body, bytes, origin, line);
    }

    /**
     * A literal piece of an f-string, with doubled braces already collapsed.
     */
    static String decodeBody(String body, boolean raw, String origin, int line) {
        return raw ? body : unescape(body, false, origin, line);
    }

    private static String unescape(String body, boolean bytes, String origin, int line) {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case '\n':
                    break;
                case '\\':
                case '\'':
                case '"':
                    out.append(e);
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 'a':
                    out.append('\u0007');
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'v':
                    out.append('\u000b');
                    break;
                case 'x':
                    out.appendCodePoint(hex(body, i, 2, origin, line));
                    i += 2;
                    break;
                case 'u':
                case 'U':
                    if (bytes) {
                        out.append('\\').append(e);
                        break;
                    }
                    int width = e == 'u' ? 4 : 8;
                    int cp = hex(body, i, width, origin, line);
                    if (!Character.isValidCodePoint(cp)) {
                        throw new SourceSyntaxException(origin, line, "illegal Unicode character");
                    }
                    out.appendCodePoint(cp);
                    i += width;
                    break;
                case 'N':
                    if (bytes) {
                        out.append("\\N");
                        break;
                    }
                    int close = body.indexOf('}', i);
                    if (i >= body.length() || body.charAt(i) != '{' || close < 0) {
                        throw new SourceSyntaxException(origin, line, "malformed \\N character escape");
                    }
                    try {
                        out.appendCodePoint(Character.codePointOf(body.substring(i + 1, close)));
                    } catch (IllegalArgumentException ex) {
                        throw new SourceSyntaxException(origin, line, "unknown Unicode character name");
                    }
                    i = close + 1;
                    break;
                default:
                    if (e >= '0' && e <= '7') {
                        int value = e - '0';
                        int digits = 1;
                        while (digits < 3 && i < body.length() && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                            value = value * 8 + (body.charAt(i) - '0');
                            i++;
                            digits++;
                        }
                        out.appendCodePoint(bytes ? value & 0xff : value);
                    } else {
                        out.append('\\').append(e);
                    }
                    break;
            }
        }
        return out.toString();
    }

    private static int hex(String body, int from, int width, String origin, int line) {
        if (from + width > body.length()) {
            throw new SourceSyntaxException(origin, line, "truncated escape sequence");
        }
        try {
            return Integer.parseUnsignedInt(body.substring(from, from + width), 16);
        } catch (NumberFormatException e) {
            throw new SourceSyntaxException(origin, line, "invalid escape sequence");
        }
    }
}
