package io.tessera.core.analysis;

/// Output encodings supported by the project analyzer.
public enum AnalysisFormat {
    /// Tabular text: a Markdown pipe table under an `Analysis` heading.
    MARKDOWN,
    /// Structured record list: a JSON array with one object per row.
    JSON,
    /// Delimited text: comma-separated values with a header row.
    CSV;

    /// Resolves a format from its case-insensitive name, accepting `md` for Markdown.
    ///
    /// @param name format name, not null
    /// @return the matching format, never null
    /// @throws IllegalArgumentException if no format matches
    public static AnalysisFormat fromName(String name) {
        if ("md".equalsIgnoreCase(name)) {
            return MARKDOWN;
        }
        for (AnalysisFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown analysis format: " + name);
    }
}
