package de.mirkosertic.termweights.weights;

/**
 * How {@link FrequencyTableLoader} treats lines that are not a valid {@code token:count} pair.
 */
public enum LineParsePolicy {

    /** Skip bad lines and keep loading the file. */
    LENIENT,

    /** Fail the file with a {@link MalformedLineException}. */
    STRICT
}
