package domain.convert;

import domain.model.Disposition;

/**
 * Immutable piece of converted statement text together with the worst disposition of the
 * call sites it contains.
 *
 * <p>Fragments are combined left to right with {@link #merge(SqlFragment, SqlFragment)}; the
 * disposition order is CONVERTED &lt; FLAGGED &lt; UNSUPPORTED &lt; SYNTAX_ERROR.</p>
 */
public final class SqlFragment {

    private static final SqlFragment EMPTY = new SqlFragment("", Disposition.CONVERTED);

    private final String text;
    private final Disposition disposition;

    private SqlFragment(String text, Disposition disposition) {
        this.text = text;
        this.disposition = disposition;
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    /** Source text copied as is. */
    public static SqlFragment verbatim(String text) {
        return of(text, Disposition.CONVERTED);
    }

    public static SqlFragment of(String text, Disposition disposition) {
        if (text == null) throw new IllegalArgumentException("text is null");
        if (disposition == null) throw new IllegalArgumentException("disposition is null");
        return new SqlFragment(text, disposition);
    }

    public static SqlFragment merge(SqlFragment a, SqlFragment b) {
        if (a == null || a.text.isEmpty() && a.disposition == Disposition.CONVERTED) return b == null ? EMPTY : b;
        if (b == null || b.text.isEmpty() && b.disposition == Disposition.CONVERTED) return a;
        return new SqlFragment(a.text + b.text, worse(a.disposition, b.disposition));
    }

    public static Disposition worse(Disposition a, Disposition b) {
        return (a.compareTo(b) >= 0) ? a : b;
    }

    public String getText() {
        return text;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    @Override
    public String toString() {
        return disposition + "{" + text + "}";
    }
}
