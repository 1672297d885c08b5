package domain.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds Tableau level-of-detail expressions: '{' followed by FIXED, INCLUDE or EXCLUDE.
 *
 * <p>T-SQL has no equivalent construct; the enclosing statement must be rewritten by hand with a
 * windowed aggregate or a grouped subquery.</p>
 */
final class LodExpressionDetector {

    private static final Set<String> LOD_KEYWORDS = Set.of("FIXED", "INCLUDE", "EXCLUDE");

    /** One occurrence: the keyword (upper case) and its offset in the scanned text. */
    static final class Match {
        final String keyword;
        final int offset;

        Match(String keyword, int offset) {
            this.keyword = keyword;
            this.offset = offset;
        }
    }

    List<Match> find(String text) {
        List<Match> out = new ArrayList<>();
        SqlScan st = new SqlScan(text);

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { st.readOpaque(); continue; }

            char c = st.read();
            if (c != '{') continue;

            int brace = st.pos - 1;
            st.readSpaces();
            if (!SqlScan.isIdentifierStart(st.peek())) continue;

            String word = st.readWord().toUpperCase(Locale.ROOT);
            if (LOD_KEYWORDS.contains(word)) {
                out.add(new Match(word, brace));
            }
        }
        return out;
    }
}
