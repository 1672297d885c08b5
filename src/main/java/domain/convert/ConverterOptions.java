package domain.convert;

import domain.mapping.TableauFabricMappings;

/**
 * Immutable conversion switches. Use {@link #defaults()} or {@link #builder()}.
 */
public final class ConverterOptions {

    private final int varcharLength;
    private final boolean rewriteBooleanLiterals;
    private final boolean detectLodExpressions;

    private ConverterOptions(Builder b) {
        this.varcharLength = b.varcharLength;
        this.rewriteBooleanLiterals = b.rewriteBooleanLiterals;
        this.detectLodExpressions = b.detectLodExpressions;
    }

    public static ConverterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Length used for STR(x) -> CAST(x AS VARCHAR(n)). */
    public int getVarcharLength() {
        return varcharLength;
    }

    public boolean isRewriteBooleanLiterals() {
        return rewriteBooleanLiterals;
    }

    public boolean isDetectLodExpressions() {
        return detectLodExpressions;
    }

    @Override
    public String toString() {
        return "ConverterOptions{varcharLength=" + varcharLength
                + ", rewriteBooleanLiterals=" + rewriteBooleanLiterals
                + ", detectLodExpressions=" + detectLodExpressions + '}';
    }

    public static final class Builder {
        private int varcharLength = TableauFabricMappings.DEFAULT_VARCHAR_LENGTH;
        private boolean rewriteBooleanLiterals = true;
        private boolean detectLodExpressions = true;

        private Builder() {
        }

        public Builder varcharLength(int varcharLength) {
            if (varcharLength <= 0) {
                throw new IllegalArgumentException("varcharLength must be positive: " + varcharLength);
            }
            this.varcharLength = varcharLength;
            return this;
        }

        public Builder rewriteBooleanLiterals(boolean rewriteBooleanLiterals) {
            this.rewriteBooleanLiterals = rewriteBooleanLiterals;
            return this;
        }

        public Builder detectLodExpressions(boolean detectLodExpressions) {
            this.detectLodExpressions = detectLodExpressions;
            return this;
        }

        public ConverterOptions build() {
            return new ConverterOptions(this);
        }
    }
}
