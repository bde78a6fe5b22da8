package org.celtext.literal;

import org.celtext.ast.Constant;
import org.celtext.error.DecodeError;
import org.celtext.result.Result;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Decoder for quoted string and bytes literal tokens.
 *
 * <p>The token is expected exactly as it appears in source, quotes included. Single ({@code '...'},
 * {@code "..."}) and triple ({@code '''...'''}, {@code """..."""}) delimiters are accepted; escape
 * sequences are processed in both. Octal and hex escapes always produce a single unit with value
 * 0-255: one code point in a string, one byte in a bytes literal. Unicode escapes are rejected in
 * bytes literals.
 */
public final class Unescaper {
    private static final int TRIPLE_QUOTE_MIN_LENGTH = 6;
    private static final int MAX_UNIT_VALUE = 0xFF;

    private final String token;
    private final String body;
    private final boolean isBytes;
    private final StringBuilder text;
    private final ByteArrayOutputStream bytes;
    private int pos;

    private Unescaper(String token, String body, boolean isBytes) {
        this.token = token;
        this.body = body;
        this.isBytes = isBytes;
        this.text = isBytes
                    ? null
                    : new StringBuilder(body.length());
        this.bytes = isBytes
                     ? new ByteArrayOutputStream(body.length())
                     : null;
        this.pos = 0;
    }

    /**
     * Decode a literal token into a {@link Constant.StringValue} or, when {@code isBytes} is set,
     * a {@link Constant.BytesValue}.
     */
    public static Result<Constant> unescape(String token, boolean isBytes) {
        return stripQuotes(token).flatMap(body -> new Unescaper(token, body, isBytes).decode());
    }

    public static Result<String> unescapeString(String token) {
        return unescape(token, false).map(value -> ((Constant.StringValue) value).value());
    }

    public static Result<byte[]> unescapeBytes(String token) {
        return unescape(token, true).map(value -> ((Constant.BytesValue) value).value());
    }

    private static Result<String> stripQuotes(String token) {
        int n = token.length();
        if (n < 2) {
            return malformed(token, "literal must be enclosed in quotes");
        }
        char quote = token.charAt(0);
        if (quote != '\'' && quote != '"') {
            return malformed(token, "literal must start with a quote");
        }
        if (token.charAt(n - 1) != quote) {
            return malformed(token, "closing quote does not match opening quote");
        }
        var triple = String.valueOf(quote)
                           .repeat(3);
        if (n >= TRIPLE_QUOTE_MIN_LENGTH && token.startsWith(triple)) {
            if (!token.endsWith(triple)) {
                return malformed(token, "triple-quoted literal must end with " + triple);
            }
            return Result.success(token.substring(3, n - 3));
        }
        return Result.success(token.substring(1, n - 1));
    }

    private static <T> Result<T> malformed(String token, String reason) {
        return Result.failure(new DecodeError.MalformedLiteral(token, token, reason));
    }

    private Result<Constant> decode() {
        while (!isAtEnd()) {
            var result = peek() == '\\'
                         ? scanEscapeSequence()
                         : emitLiteral(advanceCodePoint());
            if (result.isFailure()) {
                return result.fold(Result::failure, unit -> null);
            }
        }
        return Result.success(isBytes
                              ? new Constant.BytesValue(bytes.toByteArray())
                              : new Constant.StringValue(text.toString()));
    }

    private Result<Integer> scanEscapeSequence() {
        int start = pos;
        advance();
        // skip backslash
        if (isAtEnd()) {
            return Result.failure(new DecodeError.UnterminatedEscape(token, "\\"));
        }
        int c = advanceCodePoint();
        return switch (c) {
            case'a' -> emitLiteral(0x07);
            case'b' -> emitLiteral('\b');
            case'f' -> emitLiteral('\f');
            case'n' -> emitLiteral('\n');
            case'r' -> emitLiteral('\r');
            case't' -> emitLiteral('\t');
            case'v' -> emitLiteral(0x0B);
            case'\'', '"', '\\', '?' -> emitLiteral(c);
            case'x' -> scanHexEscape(start, 2);
            case'u' -> scanUnicodeEscape(start, 4);
            case'U' -> scanUnicodeEscape(start, 8);
            case'0', '1', '2', '3', '4', '5', '6', '7' -> scanOctalEscape(start, c - '0');
            default -> Result.failure(new DecodeError.IllegalEscape(token, fragment(start)));
        };
    }

    private Result<Integer> scanHexEscape(int start, int digits) {
        var value = scanHexDigits(start, digits);
        if (value.isFailure()) {
            return value;
        }
        return emitUnit(value.unwrap());
    }

    private Result<Integer> scanUnicodeEscape(int start, int digits) {
        if (isBytes) {
            return Result.failure(new DecodeError.UnicodeEscapeInBytes(token, fragment(start, start + 2 + digits)));
        }
        var value = scanHexDigits(start, digits);
        if (value.isFailure()) {
            return value;
        }
        int codePoint = value.unwrap();
        if (!Character.isValidCodePoint(codePoint) || isSurrogate(codePoint)) {
            return Result.failure(new DecodeError.EscapeOutOfRange(token, fragment(start)));
        }
        text.appendCodePoint(codePoint);
        return Result.success(codePoint);
    }

    private Result<Integer> scanHexDigits(int start, int digits) {
        if (pos + digits > body.length()) {
            return Result.failure(new DecodeError.InvalidEscapeDigits(token, fragment(start, body.length()), digits));
        }
        long value = 0;
        for (int i = 0; i < digits; i++) {
            int digit = Character.digit(body.charAt(pos + i), 16);
            if (digit < 0) {
                return Result.failure(new DecodeError.InvalidEscapeDigits(token, fragment(start, pos + digits), digits));
            }
            value = (value << 4) | digit;
        }
        pos += digits;
        if (value > Integer.MAX_VALUE) {
            return Result.failure(new DecodeError.EscapeOutOfRange(token, fragment(start)));
        }
        return Result.success((int) value);
    }

    // Up to three octal digits, the first already consumed.
    private Result<Integer> scanOctalEscape(int start, int firstDigit) {
        int value = firstDigit;
        for (int i = 1; i < 3 && !isAtEnd() && isOctalDigit(peek()); i++) {
            value = value * 8 + (advance() - '0');
        }
        if (value > MAX_UNIT_VALUE) {
            return Result.failure(new DecodeError.EscapeOutOfRange(token, fragment(start)));
        }
        return emitUnit(value);
    }

    /**
     * Source character: a code point in a string, its UTF-8 encoding in bytes.
     */
    private Result<Integer> emitLiteral(int codePoint) {
        if (isBytes) {
            if (isSurrogate(codePoint)) {
                return Result.failure(new DecodeError.MalformedLiteral(token,
                                                                       new String(Character.toChars(codePoint)),
                                                                       "unpaired surrogate cannot be encoded as UTF-8"));
            }
            var encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            bytes.write(encoded, 0, encoded.length);
        } else {
            text.appendCodePoint(codePoint);
        }
        return Result.success(codePoint);
    }

    /**
     * Single 0-255 unit from an octal or hex escape, never combined with its neighbours.
     */
    private Result<Integer> emitUnit(int value) {
        if (isBytes) {
            bytes.write(value);
        } else {
            text.appendCodePoint(value);
        }
        return Result.success(value);
    }

    private String fragment(int start) {
        return fragment(start, pos);
    }

    private String fragment(int start, int end) {
        return body.substring(start, Math.min(end, body.length()));
    }

    private boolean isAtEnd() {
        return pos >= body.length();
    }

    private char peek() {
        return body.charAt(pos);
    }

    private char advance() {
        return body.charAt(pos++ );
    }

    private int advanceCodePoint() {
        int codePoint = body.codePointAt(pos);
        pos += Character.charCount(codePoint);
        return codePoint;
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isSurrogate(int codePoint) {
        return codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE;
    }
}
