package domain.convert;

/**
 * Character cursor over SQL text that knows how to step over literals, quoted identifiers
 * and comments as single tokens.
 *
 * <p>Every {@code read*} token method sets {@link #truncated} when the input ended before the
 * token was closed, so callers can tell an unterminated literal from a closed one.</p>
 */
final class SqlScan {
    final String s;
    int pos = 0;
    boolean truncated = false;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    /** Character immediately before the cursor, or '\0' at the start. */
    char previous() {
        return (pos > 0) ? s.charAt(pos - 1) : '\0';
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isIdentifierPart(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    boolean peekIsBracketIdentifier() {
        return pos < s.length() && s.charAt(pos) == '[';
    }

    /** Any token that must be skipped as a whole: comment, literal or quoted identifier. */
    boolean peekIsOpaque() {
        return peekIsLineComment()
                || peekIsBlockComment()
                || peekIsSingleQuotedString()
                || peekIsDoubleQuotedString()
                || peekIsBracketIdentifier();
    }

    String readOpaque() {
        if (peekIsLineComment()) return readLineComment();
        if (peekIsBlockComment()) return readBlockComment();
        if (peekIsSingleQuotedString()) return readSingleQuotedString();
        if (peekIsDoubleQuotedString()) return readDoubleQuotedString();
        if (peekIsBracketIdentifier()) return readBracketIdentifier();
        truncated = false;
        return String.valueOf(read());
    }

    String readLineComment() {
        truncated = false;
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        truncated = true;
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                truncated = false;
                break;
            }
            pos++;
        }
        if (truncated) pos = s.length();
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        return readQuoted('\'');
    }

    String readDoubleQuotedString() {
        return readQuoted('"');
    }

    /** [Field Name] with ]] as the escaped closing bracket. */
    String readBracketIdentifier() {
        return readQuoted(']');
    }

    // opening char at pos; a doubled closing char is an escape
    private String readQuoted(char close) {
        int start = pos;
        pos++;
        truncated = true;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == close) {
                if (pos < s.length() && s.charAt(pos) == close) {
                    pos++;
                    continue;
                }
                truncated = false;
                break;
            }
        }
        return s.substring(start, pos);
    }

    /** Reads a balanced (...) block starting at the cursor; literals and comments are opaque. */
    String readParenBlock() {
        if (peek() != '(') return "";
        int start = pos;
        int depth = 0;
        truncated = true;

        while (pos < s.length()) {
            if (peekIsOpaque()) { readOpaque(); continue; }

            char c = read();
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) {
                    truncated = false;
                    break;
                }
            }
        }

        return s.substring(start, pos);
    }
}
