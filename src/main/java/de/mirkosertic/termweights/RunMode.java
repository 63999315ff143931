package de.mirkosertic.termweights;

import de.mirkosertic.termweights.config.ConfigurationException;

import java.util.Locale;

/**
 * The stage a run executes, selected by the first command line argument.
 */
public enum RunMode {

    /** HTML files to per-document token frequency files. */
    TOKENIZE,

    /** Token frequency files to ranked TF-IDF weight files. */
    WEIGHTS;

    public static RunMode fromArguments(final String[] args) throws ConfigurationException {
        if (args.length == 0) {
            return WEIGHTS;
        }
        if (args.length > 1) {
            throw new ConfigurationException("Expected at most one argument (tokenize|weights), got " + args.length);
        }
        try {
            return valueOf(args[0].trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException("Unknown run mode '" + args[0] + "', expected tokenize or weights", e);
        }
    }
}
