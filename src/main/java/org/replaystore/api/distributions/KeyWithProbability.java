package org.replaystore.api.distributions;

/**
 * Result of sampling a key distribution.
 *
 * @param key         The selected item key
 * @param probability The probability the key had of being selected
 */
public record KeyWithProbability(long key, double probability) {
}
