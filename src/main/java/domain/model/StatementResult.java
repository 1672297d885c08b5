package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversion outcome of one statement: its disposition, its converted text, and what the
 * reviewer has to look at.
 */
public final class StatementResult {

    private final int number;
    private final int startLine;
    private final Disposition disposition;
    private final String originalText;
    private final String convertedText;
    private final List<CallSiteResult> callSites;
    private final List<FlaggedItem> flaggedItems;

    private StatementResult(
            int number,
            int startLine,
            Disposition disposition,
            String originalText,
            String convertedText,
            List<CallSiteResult> callSites,
            List<FlaggedItem> flaggedItems
    ) {
        this.number = number;
        this.startLine = startLine;
        this.disposition = disposition;
        this.originalText = originalText == null ? "" : originalText;
        this.convertedText = convertedText == null ? this.originalText : convertedText;
        this.callSites = Collections.unmodifiableList(new ArrayList<>(callSites));
        this.flaggedItems = Collections.unmodifiableList(new ArrayList<>(flaggedItems));
    }

    /**
     * Statement that went through recognition and rewriting.
     *
     * <p>FLAGGED when any call site is FLAGGED/UNSUPPORTED or a statement-level flag exists,
     * otherwise CONVERTED (including statements without any call).</p>
     *
     * @param statementFlags statement-level items such as LOD expressions
     */
    public static StatementResult rewritten(
            int number,
            int startLine,
            String originalText,
            String convertedText,
            List<CallSiteResult> callSites,
            List<FlaggedItem> statementFlags
    ) {
        List<FlaggedItem> items = new ArrayList<>();
        if (statementFlags != null) items.addAll(statementFlags);

        List<CallSiteResult> sites = (callSites == null) ? List.of() : callSites;
        for (CallSiteResult cs : sites) {
            if (cs.isConverted()) continue;
            items.add(new FlaggedItem(number, cs.getLine(), cs.getFunctionName(), cs.getCode(), cs.getReason()));
        }

        Disposition d = items.isEmpty() ? Disposition.CONVERTED : Disposition.FLAGGED;
        return new StatementResult(number, startLine, d, originalText, convertedText, sites, items);
    }

    /** Statement rejected by the structural check; text passes through verbatim. */
    public static StatementResult syntaxError(int number, int startLine, String text, String description) {
        FlaggedItem item = FlaggedItem.ofStatement(number, startLine, FlagCode.SYNTAX_ERROR, description);
        return new StatementResult(number, startLine, Disposition.SYNTAX_ERROR, text, text, List.of(), List.of(item));
    }

    /** Conversion failed unexpectedly; text passes through verbatim. */
    public static StatementResult conversionError(int number, int startLine, String text, String reason) {
        FlaggedItem item = FlaggedItem.ofStatement(number, startLine, FlagCode.CONVERSION_ERROR, reason);
        return new StatementResult(number, startLine, Disposition.FLAGGED, text, text, List.of(), List.of(item));
    }

    public int getNumber() {
        return number;
    }

    public int getStartLine() {
        return startLine;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getConvertedText() {
        return convertedText;
    }

    public List<CallSiteResult> getCallSites() {
        return callSites;
    }

    public List<FlaggedItem> getFlaggedItems() {
        return flaggedItems;
    }
}
