package de.mirkosertic.termweights.weights;

/**
 * One line of a ranked weight export.
 */
public record WeightedTerm(String token, double weight) {
}
