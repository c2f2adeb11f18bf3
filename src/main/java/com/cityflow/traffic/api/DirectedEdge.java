package com.cityflow.traffic.api;

/**
 * One orientation of a road, used as the memoization key of the traversal.
 *
 * {@code (city, excluded)} stands for "the traffic of the subtree hanging off
 * {@code city} when {@code excluded} is the direction not to recurse into".
 * {@code (a, b)} and {@code (b, a)} are distinct keys.
 *
 * A rooted edge has no exclusion at all; it is the entry point of a root
 * evaluation. Its {@code excluded} field is meaningless and always 0.
 *
 * @param city         the city the subtree hangs off.
 * @param excluded     the parent direction, valid only if {@code hasExclusion}.
 * @param hasExclusion false for the rooted variant.
 */
public record DirectedEdge(long city, long excluded, boolean hasExclusion) {

    public static DirectedEdge of(long city, long excluded) {
        return new DirectedEdge(city, excluded, true);
    }

    public static DirectedEdge rooted(long city) {
        return new DirectedEdge(city, 0L, false);
    }

    /** True when {@code neighbour} is the excluded parent direction. */
    public boolean excludes(long neighbour) {
        return hasExclusion && excluded == neighbour;
    }

    @Override
    public String toString() {
        String from = Long.toUnsignedString(city);
        return hasExclusion ? from + "<-" + Long.toUnsignedString(excluded) : from + "<-*";
    }
}
