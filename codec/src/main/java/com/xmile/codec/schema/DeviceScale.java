package com.xmile.codec.schema;

/**
 * Display scale of a variable: explicit bounds, automatic, or shared with the numbered scale group.
 * Bounds are null when the scale is automatic or grouped.
 */
public record DeviceScale(Double min, Double max, Boolean auto, Integer group) {

    public static DeviceScale bounds(double min, double max) {
        return new DeviceScale(min, max, null, null);
    }
}
