package com.xmile.codec.schema;

/**
 * Queue overflow and conveyor leakage settings of a flow. {@code leakStart} and {@code leakEnd} are
 * fractions of the conveyor length bounding the leak zone.
 */
public record TransitOptions(
        boolean overflow, boolean leak, boolean leakIntegers, Double leakStart, Double leakEnd) {

    /** Null when nothing is set, so a flow without these elements carries no options. */
    public static TransitOptions of(
            boolean overflow, boolean leak, boolean leakIntegers, Double leakStart, Double leakEnd) {
        if (!overflow && !leak && !leakIntegers && leakStart == null && leakEnd == null) {
            return null;
        }
        return new TransitOptions(overflow, leak, leakIntegers, leakStart, leakEnd);
    }
}
