package domain.convert;

/**
 * Turns comment tokens into their bodies so statements can carry detached comments as plain text.
 */
final class CommentExtractor {

    private CommentExtractor() {
    }

    static String bodyOf(String commentToken) {
        if (commentToken == null) return "";
        String c = commentToken.trim();
        if (c.startsWith("--")) return lineCommentBody(c);
        if (c.startsWith("/*")) return blockCommentBody(c);
        return c;
    }

    private static String blockCommentBody(String c) {
        // unterminated block comments keep everything after the opener
        int end = c.endsWith("*/") && c.length() >= 4 ? c.length() - 2 : c.length();
        return c.substring(2, end)
                .trim();
    }

    private static String lineCommentBody(String c) {
        return c.substring(2)
                .trim();
    }
}
