package com.xmile.codec.schema;

/**
 * Simulation settings. Start and stop are required at document and model level; inside a macro only
 * the method and time units attributes are used.
 */
public record SimSpecs(
        Double start,
        Double stop,
        Double dt,
        String method,
        String timeUnits,
        Double pause,
        String runBy) {

    public static SimSpecs of(double start, double stop, double dt) {
        return new SimSpecs(start, stop, dt, null, null, null, null);
    }
}
