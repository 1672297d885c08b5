package domain.convert;

import domain.mapping.FunctionMappingLookup;

import java.util.*;

/**
 * Finds function call sites in a validated statement and resolves each against the mapping table.
 *
 * <p>A call site is a maximal identifier token followed by optional whitespace and '('.
 * Literals, quoted identifiers and comments are skipped as whole tokens. Nested calls are
 * reported as separate call sites that point at their enclosing call.</p>
 */
public final class FunctionCallRecognizer {

    // keywords that may legally precede '('
    private static final Set<String> KEYWORDS = Set.of(
            "ALL", "AND", "ANY", "AS", "BETWEEN", "BY", "CASE", "CHECK", "CONSTRAINT", "CROSS",
            "DEFAULT", "DELETE", "DISTINCT", "ELSE", "END", "EXCEPT", "EXISTS", "FOREIGN", "FROM",
            "FULL", "GROUP", "HAVING", "IN", "INNER", "INSERT", "INTERSECT", "INTO", "IS", "JOIN",
            "KEY", "LIKE", "MERGE", "NOT", "ON", "OR", "ORDER", "OUTER", "OVER", "PARTITION",
            "PRIMARY", "REFERENCES", "RETURN", "RETURNS", "SELECT", "SET", "SOME", "TABLE", "THEN",
            "TOP", "UNION", "UNIQUE", "UPDATE", "USING", "VALUES", "VIEW", "WHEN", "WHERE", "WITH",
            "WITHIN"
    );

    // the identifier after these names an object, e.g. INSERT INTO dbo.t (a, b)
    private static final Set<String> NAME_POSITION = Set.of(
            "AS", "FUNCTION", "INTO", "PROCEDURE", "REFERENCES", "TABLE", "VIEW", "WITH"
    );

    private final FunctionMappingLookup mappings;

    public FunctionCallRecognizer(FunctionMappingLookup mappings) {
        if (mappings == null) throw new IllegalArgumentException("mappings is null");
        this.mappings = mappings;
    }

    /** Call sites of a statement, in source order. */
    public List<CallSite> recognize(SqlStatement statement) {
        return recognize(statement.getText(), statement.getStartLine());
    }

    /**
     * @param firstLine source line of the first character of {@code text}
     */
    public List<CallSite> recognize(String text, int firstLine) {
        if (text == null || text.isEmpty()) return List.of();

        SqlScan st = new SqlScan(text);
        LineIndex lines = new LineIndex(text);

        List<Pending> found = new ArrayList<>();
        // null entries are grouping parentheses
        Deque<Pending> open = new ArrayDeque<>();
        Pending candidate = null;
        // next identifier names an object; survives qualifier dots as in [dbo].t
        boolean objectName = false;
        boolean afterObjectName = false;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) {
                boolean comment = st.peekIsLineComment() || st.peekIsBlockComment();
                boolean quotedName = st.peekIsBracketIdentifier() || st.peekIsDoubleQuotedString();
                st.readOpaque();
                if (!comment) {
                    afterObjectName = quotedName && objectName;
                    objectName = false;
                    candidate = null;
                }
                continue;
            }

            char c = st.peek();

            if (Character.isWhitespace(c)) {
                st.read();
                continue;
            }

            if (SqlScan.isIdentifierStart(c)) {
                char before = st.previous();
                int start = st.pos;
                String word = st.readWord();
                String upper = word.toUpperCase(Locale.ROOT);

                candidate = null;
                if (!objectName && isCandidate(upper, before)) {
                    int p = st.pos;
                    while (p < text.length() && Character.isWhitespace(text.charAt(p))) p++;
                    if (p < text.length() && text.charAt(p) == '(') {
                        candidate = new Pending(word, start, st.pos, p, lines.lineOf(start) + firstLine - 1);
                    }
                }
                afterObjectName = objectName;
                objectName = NAME_POSITION.contains(upper);
                continue;
            }

            if (Character.isDigit(c)) {
                // numeric literal such as 1e10 or 0x1F
                st.readWord();
                objectName = false;
                afterObjectName = false;
                candidate = null;
                continue;
            }

            st.read();
            if (c == '.') {
                objectName = afterObjectName;
                afterObjectName = false;
                candidate = null;
                continue;
            }
            if (c == '(') {
                Pending call = (candidate != null && candidate.openParen == st.pos - 1) ? candidate : null;
                if (call != null) {
                    call.parent = enclosingCall(open);
                    found.add(call);
                }
                open.push(call == null ? Pending.GROUP : call);
            } else if (c == ')') {
                if (!open.isEmpty()) {
                    Pending closed = open.pop();
                    if (closed != Pending.GROUP) closed.closeParen = st.pos - 1;
                }
            }
            objectName = false;
            afterObjectName = false;
            candidate = null;
        }

        return toCallSites(text, found);
    }

    private static boolean isCandidate(String upperWord, char before) {
        if (before == '@' || before == '#' || before == '$') return false;
        return !KEYWORDS.contains(upperWord);
    }

    private static Pending enclosingCall(Deque<Pending> open) {
        for (Pending p : open) {
            if (p != Pending.GROUP) return p;
        }
        return null;
    }

    private List<CallSite> toCallSites(String text, List<Pending> found) {
        Map<Pending, Integer> indexOf = new IdentityHashMap<>();
        List<CallSite> out = new ArrayList<>(found.size());

        for (Pending p : found) {
            // unclosed calls only occur in text that failed validation
            if (p.closeParen < 0) continue;
            if (p.parent != null && !indexOf.containsKey(p.parent)) continue;

            int idx = out.size();
            indexOf.put(p, idx);
            int parent = (p.parent == null) ? CallSite.NO_PARENT : indexOf.get(p.parent);
            out.add(new CallSite(
                    idx,
                    p.name,
                    p.nameStart,
                    p.nameEnd,
                    p.openParen,
                    p.closeParen,
                    text.substring(p.openParen + 1, p.closeParen),
                    parent,
                    p.line,
                    mappings.find(p.name)
            ));
        }
        return Collections.unmodifiableList(out);
    }

    private static final class Pending {
        static final Pending GROUP = new Pending("", -1, -1, -1, -1);

        final String name;
        final int nameStart;
        final int nameEnd;
        final int openParen;
        final int line;
        int closeParen = -1;
        Pending parent;

        Pending(String name, int nameStart, int nameEnd, int openParen, int line) {
            this.name = name;
            this.nameStart = nameStart;
            this.nameEnd = nameEnd;
            this.openParen = openParen;
            this.line = line;
        }
    }
}
