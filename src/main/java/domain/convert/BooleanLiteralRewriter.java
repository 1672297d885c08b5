package domain.convert;

import java.util.Locale;

/**
 * Replaces bare TRUE/FALSE tokens with 1/0, since T-SQL has no boolean literals.
 * Literals, quoted identifiers and comments are left alone.
 */
final class BooleanLiteralRewriter {

    String rewrite(String text) {
        if (text == null || text.isEmpty()) return "";

        StringBuilder out = new StringBuilder(text.length());
        SqlScan st = new SqlScan(text);

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { out.append(st.readOpaque()); continue; }

            char c = st.peek();
            if (SqlScan.isIdentifierPart(c)) {
                char before = st.previous();
                String word = st.readWord();
                if (before == '.' || before == '@' || before == '#' || before == '$') {
                    out.append(word);
                    continue;
                }
                switch (word.toUpperCase(Locale.ROOT)) {
                    case "TRUE" -> out.append('1');
                    case "FALSE" -> out.append('0');
                    default -> out.append(word);
                }
                continue;
            }
            out.append(st.read());
        }
        return out.toString();
    }
}
