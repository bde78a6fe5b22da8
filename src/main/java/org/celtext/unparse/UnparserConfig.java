package org.celtext.unparse;

/**
 * Unparser configuration options.
 *
 * @param restoreSpacing    Pad node text with spaces up to the recorded source offsets
 * @param restoreLineBreaks Turn spaces at recorded line-break offsets into line breaks
 */
public record UnparserConfig(
    boolean restoreSpacing,
    boolean restoreLineBreaks
) {
    public static final UnparserConfig DEFAULT = new UnparserConfig(
        true,
        true
    );

    /**
     * Canonical single-line output that ignores source positions.
     */
    public static final UnparserConfig COMPACT = new UnparserConfig(
        false,
        false
    );

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean restoreSpacing = true;
        private boolean restoreLineBreaks = true;

        private Builder() {}

        public Builder spacing(boolean restore) {
            this.restoreSpacing = restore;
            return this;
        }

        public Builder lineBreaks(boolean restore) {
            this.restoreLineBreaks = restore;
            return this;
        }

        public UnparserConfig build() {
            return new UnparserConfig(restoreSpacing, restoreLineBreaks);
        }
    }
}
