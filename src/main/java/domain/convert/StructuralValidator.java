package domain.convert;

/**
 * Counting balance check run on every statement before any rewriting.
 *
 * <p>Parentheses and braces are counted outside literals, quoted identifiers and comments; each
 * quoted token must be closed. The first problem found is reported.</p>
 */
public final class StructuralValidator {

    public static final String UNBALANCED_PARENTHESES = "unbalanced parentheses";
    public static final String UNBALANCED_BRACES = "unbalanced braces";
    public static final String UNTERMINATED_STRING = "unterminated string literal";
    public static final String UNTERMINATED_QUOTED_IDENTIFIER = "unterminated quoted identifier";
    public static final String UNTERMINATED_BRACKET_IDENTIFIER = "unterminated bracket identifier";
    public static final String UNTERMINATED_BLOCK_COMMENT = "unterminated block comment";
    public static final String UNTERMINATED_STATEMENT = "unterminated statement";

    public ValidationResult validate(SqlStatement statement) {
        if (statement == null) return ValidationResult.ok();
        ValidationResult r = validate(statement.getText());
        if (r.isOk() && !statement.isValid()) {
            return ValidationResult.error(UNTERMINATED_STATEMENT);
        }
        return r;
    }

    public ValidationResult validate(String text) {
        SqlScan st = new SqlScan(text);
        int parens = 0;
        int braces = 0;

        while (st.hasNext()) {
            if (st.peekIsLineComment()) { st.readLineComment(); continue; }
            if (st.peekIsBlockComment()) {
                st.readBlockComment();
                if (st.truncated) return ValidationResult.error(UNTERMINATED_BLOCK_COMMENT);
                continue;
            }
            if (st.peekIsSingleQuotedString()) {
                st.readSingleQuotedString();
                if (st.truncated) return ValidationResult.error(UNTERMINATED_STRING);
                continue;
            }
            if (st.peekIsDoubleQuotedString()) {
                st.readDoubleQuotedString();
                if (st.truncated) return ValidationResult.error(UNTERMINATED_QUOTED_IDENTIFIER);
                continue;
            }
            if (st.peekIsBracketIdentifier()) {
                st.readBracketIdentifier();
                if (st.truncated) return ValidationResult.error(UNTERMINATED_BRACKET_IDENTIFIER);
                continue;
            }

            switch (st.read()) {
                case '(' -> parens++;
                case ')' -> {
                    if (--parens < 0) return ValidationResult.error(UNBALANCED_PARENTHESES);
                }
                case '{' -> braces++;
                case '}' -> {
                    if (--braces < 0) return ValidationResult.error(UNBALANCED_BRACES);
                }
                default -> {
                }
            }
        }

        if (parens != 0) return ValidationResult.error(UNBALANCED_PARENTHESES);
        if (braces != 0) return ValidationResult.error(UNBALANCED_BRACES);
        return ValidationResult.ok();
    }
}
