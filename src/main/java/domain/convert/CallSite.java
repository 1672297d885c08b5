package domain.convert;

import domain.mapping.FunctionMapping;

/**
 * One {@code name(args)} occurrence inside a statement.
 *
 * <p>Offsets are relative to the statement text. {@code mapping} is null when the function is
 * not in the table.</p>
 */
public final class CallSite {

    public static final int NO_PARENT = -1;

    private final int index;
    private final String name;
    private final int nameStart;
    private final int nameEnd;
    private final int openParen;
    private final int closeParen;
    private final String argumentText;
    private final int parent;
    private final int line;
    private final FunctionMapping mapping;

    CallSite(
            int index,
            String name,
            int nameStart,
            int nameEnd,
            int openParen,
            int closeParen,
            String argumentText,
            int parent,
            int line,
            FunctionMapping mapping
    ) {
        this.index = index;
        this.name = name;
        this.nameStart = nameStart;
        this.nameEnd = nameEnd;
        this.openParen = openParen;
        this.closeParen = closeParen;
        this.argumentText = argumentText;
        this.parent = parent;
        this.line = line;
        this.mapping = mapping;
    }

    /** Position in source order within the statement. */
    public int getIndex() {
        return index;
    }

    /** As written. */
    public String getName() {
        return name;
    }

    public int getNameStart() {
        return nameStart;
    }

    public int getNameEnd() {
        return nameEnd;
    }

    public int getOpenParen() {
        return openParen;
    }

    public int getCloseParen() {
        return closeParen;
    }

    /** Raw text between the parentheses, unsplit. */
    public String getArgumentText() {
        return argumentText;
    }

    /** Index of the innermost enclosing call, or {@link #NO_PARENT}. */
    public int getParent() {
        return parent;
    }

    public int getLine() {
        return line;
    }

    public FunctionMapping getMapping() {
        return mapping;
    }

    public boolean isMapped() {
        return mapping != null;
    }

    @Override
    public String toString() {
        return name + "(" + argumentText + ")@" + nameStart;
    }
}
