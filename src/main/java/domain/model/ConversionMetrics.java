package domain.model;

import domain.mapping.FunctionCategory;

import java.util.*;

/**
 * Outcome counts, flagged items and unsupported functions of one conversion.
 *
 * <p>Owned by the conversion call that created it; not thread-safe. Parallel work builds one
 * instance per unit and combines them with {@link #merge(ConversionMetrics, ConversionMetrics)}.</p>
 *
 * <p>{@code successful + flagged + syntaxError == total} holds at all times: every
 * {@link #record(StatementResult)} increments {@code total} and exactly one bucket.</p>
 */
public final class ConversionMetrics {

    private int total;
    private int successful;
    private int flagged;
    private int syntaxError;

    private final List<FlaggedItem> flaggedItems = new ArrayList<>();
    // UPPER-cased names, first-seen order
    private final Set<String> unsupportedFunctions = new LinkedHashSet<>();
    private final Map<FunctionCategory, Integer> conversionsByCategory = new EnumMap<>(FunctionCategory.class);

    public static ConversionMetrics empty() {
        return new ConversionMetrics();
    }

    public void record(StatementResult result) {
        if (result == null) throw new IllegalArgumentException("result is null");

        total++;
        switch (result.getDisposition()) {
            case CONVERTED -> successful++;
            case SYNTAX_ERROR -> syntaxError++;
            default -> flagged++;
        }

        flaggedItems.addAll(result.getFlaggedItems());

        for (CallSiteResult cs : result.getCallSites()) {
            if (cs.getDisposition() == Disposition.UNSUPPORTED) {
                unsupportedFunctions.add(cs.getFunctionName().toUpperCase(Locale.ROOT));
            } else if (cs.isConverted() && cs.isChanged()) {
                conversionsByCategory.merge(cs.getCategory(), 1, Integer::sum);
            }
        }
    }

    /**
     * Pure reduce of two partial results: counters and category counts are summed, unsupported
     * sets united, flagged items concatenated left then right. Neither argument is modified.
     */
    public static ConversionMetrics merge(ConversionMetrics a, ConversionMetrics b) {
        ConversionMetrics m = new ConversionMetrics();
        for (ConversionMetrics src : new ConversionMetrics[]{a, b}) {
            if (src == null) continue;
            m.total += src.total;
            m.successful += src.successful;
            m.flagged += src.flagged;
            m.syntaxError += src.syntaxError;
            m.flaggedItems.addAll(src.flaggedItems);
            m.unsupportedFunctions.addAll(src.unsupportedFunctions);
            src.conversionsByCategory.forEach((k, v) -> m.conversionsByCategory.merge(k, v, Integer::sum));
        }
        return m;
    }

    /** successful / total as a percentage; 0.0 for an empty input. */
    public double successRate() {
        if (total == 0) return 0.0;
        return successful * 100.0 / total;
    }

    public int getTotal() {
        return total;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFlagged() {
        return flagged;
    }

    public int getSyntaxError() {
        return syntaxError;
    }

    public List<FlaggedItem> getFlaggedItems() {
        return Collections.unmodifiableList(flaggedItems);
    }

    public Set<String> getUnsupportedFunctions() {
        return Collections.unmodifiableSet(unsupportedFunctions);
    }

    /** Changed call sites per category; already-native calls are not counted. */
    public Map<FunctionCategory, Integer> getConversionsByCategory() {
        return Collections.unmodifiableMap(conversionsByCategory);
    }

    public int getTotalConversions() {
        int n = 0;
        for (int v : conversionsByCategory.values()) n += v;
        return n;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "total=%d, successful=%d, flagged=%d, syntaxError=%d, successRate=%.1f%%, unsupported=%s",
                total, successful, flagged, syntaxError, successRate(), unsupportedFunctions);
    }
}
