package com.xmile.codec.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

final class GraphicalFunctionDataTest {

    @Test
    void uniformScaleSpreadsPointsEvenly() {
        GraphicalFunctionData.UniformScale data =
                new GraphicalFunctionData.UniformScale(
                        new GraphicalFunctionScale(0, 100), null, List.of(1.0, 2.0, 3.0, 4.0, 5.0), null);

        assertEquals(0.0, data.xAt(0));
        assertEquals(25.0, data.xAt(1));
        assertEquals(100.0, data.xAt(4));
    }

    @Test
    void singlePointSitsAtMinimum() {
        GraphicalFunctionData.UniformScale data =
                new GraphicalFunctionData.UniformScale(
                        new GraphicalFunctionScale(3, 9), null, List.of(7.0), null);

        assertEquals(3.0, data.xAt(0));
    }
}
