package org.celtext.error;

import org.celtext.result.Cause;

/**
 * Failure to decode a quoted literal token.
 * Every variant carries the complete token and the fragment that could not be decoded.
 */
public sealed interface DecodeError extends Cause {
    String token();

    String fragment();

    /**
     * Token is not delimited by a matching quote run.
     */
    record MalformedLiteral(
    String token,
    String fragment,
    String reason) implements DecodeError {
        @Override
        public String message() {
            return "Malformed literal " + token + ": " + reason;
        }
    }

    /**
     * Backslash is the last character of the literal body.
     */
    record UnterminatedEscape(
    String token,
    String fragment) implements DecodeError {
        @Override
        public String message() {
            return "Unterminated escape sequence at end of " + token;
        }
    }

    /**
     * Hex or unicode escape with too few or non-hex digits.
     */
    record InvalidEscapeDigits(
    String token,
    String fragment,
    int expectedDigits) implements DecodeError {
        @Override
        public String message() {
            return "Escape '" + fragment + "' in " + token + " requires " + expectedDigits + " hex digits";
        }
    }

    /**
     * Octal value above 255 or unicode escape outside the code point range.
     */
    record EscapeOutOfRange(
    String token,
    String fragment) implements DecodeError {
        @Override
        public String message() {
            return "Escape '" + fragment + "' in " + token + " is out of range";
        }
    }

    /**
     * Unicode escape inside a bytes literal.
     */
    record UnicodeEscapeInBytes(
    String token,
    String fragment) implements DecodeError {
        @Override
        public String message() {
            return "Unicode escape '" + fragment + "' is not allowed in bytes literal " + token;
        }
    }

    /**
     * Unknown character after a backslash.
     */
    record IllegalEscape(
    String token,
    String fragment) implements DecodeError {
        @Override
        public String message() {
            return "Illegal escape sequence '" + fragment + "' in " + token;
        }
    }
}
