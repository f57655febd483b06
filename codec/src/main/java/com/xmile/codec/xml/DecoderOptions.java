package com.xmile.codec.xml;

/**
 * Decoder settings. {@link #fromEnvironment()} reads the {@code xmile.decoder.strict} system
 * property, falling back to the {@code XMILE_DECODER_STRICT} environment variable.
 */
public final class DecoderOptions {

    private static final String STRICT_PROPERTY = "xmile.decoder.strict";
    private static final String STRICT_ENV = "XMILE_DECODER_STRICT";

    private static final DecoderOptions LENIENT = new DecoderOptions(false);
    private static final DecoderOptions STRICT = new DecoderOptions(true);

    private final boolean strict;

    private DecoderOptions(boolean strict) {
        this.strict = strict;
    }

    public static DecoderOptions lenient() {
        return LENIENT;
    }

    public static DecoderOptions strict() {
        return STRICT;
    }

    public static DecoderOptions fromEnvironment() {
        String value = System.getProperty(STRICT_PROPERTY);
        if (value == null) {
            value = System.getenv(STRICT_ENV);
        }
        return Boolean.parseBoolean(value) ? STRICT : LENIENT;
    }

    /** When set, unknown elements fail the decode instead of being skipped. */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public String toString() {
        return "DecoderOptions(strict=" + strict + ")";
    }
}
