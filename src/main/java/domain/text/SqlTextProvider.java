package domain.text;

/**
 * Loads the raw text of an input file.
 */
public interface SqlTextProvider {
    String read(SqlSource source);
}
