package domain.convert;

import domain.model.ConversionMetrics;
import domain.model.StatementResult;

import java.util.Collections;
import java.util.List;

/**
 * Result of {@link SqlDialectConverter#convert(String)}.
 */
public final class ConversionOutput {

    private final String text;
    private final ConversionMetrics metrics;
    private final List<StatementResult> statements;

    ConversionOutput(String text, ConversionMetrics metrics, List<StatementResult> statements) {
        this.text = text;
        this.metrics = metrics;
        this.statements = Collections.unmodifiableList(statements);
    }

    public String getText() {
        return text;
    }

    public ConversionMetrics getMetrics() {
        return metrics;
    }

    /** One entry per segmented statement, in input order. */
    public List<StatementResult> getStatements() {
        return statements;
    }
}
