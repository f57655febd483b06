package com.xmile.codec.xml;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class DecoderOptionsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("xmile.decoder.strict");
    }

    @Test
    void systemPropertyEnablesStrictMode() {
        System.setProperty("xmile.decoder.strict", "true");

        assertTrue(DecoderOptions.fromEnvironment().isStrict());
    }

    @Test
    void anythingElseIsLenient() {
        System.setProperty("xmile.decoder.strict", "yes");

        assertFalse(DecoderOptions.fromEnvironment().isStrict());
        assertFalse(DecoderOptions.lenient().isStrict());
        assertTrue(DecoderOptions.strict().isStrict());
    }
}
