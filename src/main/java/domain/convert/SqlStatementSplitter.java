package domain.convert;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits cleaned SQL text into top-level statements and argument lists into top-level arguments.
 *
 * <p>';' and ',' only count outside literals, quoted or bracketed identifiers, comments and
 * parentheses.</p>
 */
public final class SqlStatementSplitter {

    public List<SqlStatement> split(String text) {
        List<SqlStatement> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        SqlScan st = new SqlScan(text);
        LineIndex lines = new LineIndex(text);

        while (st.hasNext()) {
            List<String> comments = new ArrayList<>();

            // leading gap: whitespace, comments and empty statements
            while (st.hasNext()) {
                if (Character.isWhitespace(st.peek()) || st.peek() == ';') { st.read(); continue; }
                if (st.peekIsLineComment() || st.peekIsBlockComment()) {
                    comments.add(CommentExtractor.bodyOf(st.readOpaque()));
                    continue;
                }
                break;
            }
            if (!st.hasNext()) break;

            int start = st.pos;
            int lastCodeEnd = start;
            int depth = 0;
            boolean unterminated = false;

            while (st.hasNext()) {
                if (st.peekIsLineComment() || st.peekIsBlockComment()) {
                    comments.add(CommentExtractor.bodyOf(st.readOpaque()));
                    if (st.truncated) unterminated = true;
                    continue;
                }
                if (st.peekIsOpaque()) {
                    st.readOpaque();
                    if (st.truncated) unterminated = true;
                    lastCodeEnd = st.pos;
                    continue;
                }

                char c = st.peek();
                if (c == ';' && depth == 0) break;

                st.read();
                if (c == '(') depth++;
                else if (c == ')') depth = Math.max(0, depth - 1);
                if (!Character.isWhitespace(c)) lastCodeEnd = st.pos;
            }

            boolean valid = !unterminated && depth == 0;
            // an open literal or comment swallows the rest of the input
            int end = unterminated ? text.length() : lastCodeEnd;
            out.add(new SqlStatement(
                    out.size() + 1,
                    text.substring(start, end),
                    start,
                    end,
                    lines.lineOf(start),
                    comments,
                    valid
            ));

            if (st.hasNext()) st.read(); // ;
        }

        return out;
    }

    /**
     * Splits an argument list on top-level commas. Parts are returned untrimmed; an empty input
     * yields an empty list.
     */
    public static List<String> splitTopLevelByComma(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(s);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { cur.append(st.readOpaque()); continue; }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);

            if (ch == ',' && depth == 0) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }

        out.add(cur.toString());
        return out;
    }
}
