package domain.text;

/**
 * Normalizes raw Tableau SQL before conversion.
 *
 * <ul>
 *   <li>CRLF and lone CR become LF</li>
 *   <li>trailing whitespace is removed from every line</li>
 *   <li>Tableau {@code //} comments become {@code --} comments</li>
 * </ul>
 *
 * <p>Quoted literals and identifiers are never touched. Cleaning already-clean text returns it
 * unchanged.</p>
 */
public final class SqlTextCleaner {

    public String clean(String raw) {
        if (raw == null || raw.isEmpty()) return "";

        String s = raw.replace("\r\n", "\n").replace('\r', '\n');
        s = convertSlashComments(s);
        return trimLineEnds(s);
    }

    private static String convertSlashComments(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int n = s.length();
        int i = 0;

        while (i < n) {
            char c = s.charAt(i);

            if (c == '\'' || c == '"' || c == '[') {
                char close = (c == '[') ? ']' : c;
                int end = i + 1;
                while (end < n) {
                    if (s.charAt(end) == close) {
                        if (end + 1 < n && s.charAt(end + 1) == close) { end += 2; continue; }
                        end++;
                        break;
                    }
                    end++;
                }
                out.append(s, i, Math.min(end, n));
                i = end;
                continue;
            }

            if (c == '-' && i + 1 < n && s.charAt(i + 1) == '-') {
                int nl = s.indexOf('\n', i);
                int end = (nl < 0) ? n : nl;
                out.append(s, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                int close = s.indexOf("*/", i + 2);
                int end = (close < 0) ? n : close + 2;
                out.append(s, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < n && s.charAt(i + 1) == '/') {
                out.append("--");
                i += 2;
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static String trimLineEnds(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int start = 0;
        while (true) {
            int nl = s.indexOf('\n', start);
            int end = (nl < 0) ? s.length() : nl;
            int e = end;
            while (e > start && Character.isWhitespace(s.charAt(e - 1))) e--;
            out.append(s, start, e);
            if (nl < 0) break;
            out.append('\n');
            start = nl + 1;
        }
        return out.toString();
    }
}
