package org.celtext.unparse;

import com.google.common.escape.UnicodeEscaper;

/**
 * Renders string values as double-quoted literals. Printable characters are kept as they are;
 * quotes, backslashes and control characters use the shortest escape the decoder accepts.
 */
final class StringQuoter extends UnicodeEscaper {
    static final StringQuoter INSTANCE = new StringQuoter();

    private StringQuoter() {}

    /**
     * @throws IllegalArgumentException if the value contains an unpaired surrogate
     */
    static String quote(String value) {
        return '"' + INSTANCE.escape(value) + '"';
    }

    @Override
    protected char[] escape(int cp) {
        switch (cp) {
            case 0x07:
                return chars("\\a");
            case '\b':
                return chars("\\b");
            case '\f':
                return chars("\\f");
            case '\n':
                return chars("\\n");
            case '\r':
                return chars("\\r");
            case '\t':
                return chars("\\t");
            case 0x0B:
                return chars("\\v");
            case '"':
                return chars("\\\"");
            case '\\':
                return chars("\\\\");
            default:
                break;
        }
        if (isPrintable(cp)) {
            return null;
        }
        if (cp < ' ' || cp == 0x7F) {
            return chars(String.format("\\x%02x", cp));
        }
        if (cp < 0x10000) {
            return chars(String.format("\\u%04x", cp));
        }
        return chars(String.format("\\U%08x", cp));
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.SPACE_SEPARATOR:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    private static char[] chars(String s) {
        return s.toCharArray();
    }
}
