package com.xmile.codec.schema;

import java.util.List;
import java.util.Objects;

/**
 * Points of a graphical function. Separators are the recorded {@code sep} attributes; null means the
 * default comma.
 */
public sealed interface GraphicalFunctionData {

    String DEFAULT_SEPARATOR = ",";

    GraphicalFunctionScale xScale();

    GraphicalFunctionScale yScale();

    List<Double> yValues();

    String ySeparator();

    /** Y values spread evenly across the x scale. */
    record UniformScale(
            GraphicalFunctionScale xScale,
            GraphicalFunctionScale yScale,
            List<Double> yValues,
            String ySeparator)
            implements GraphicalFunctionData {

        public UniformScale {
            Objects.requireNonNull(xScale, "xScale");
            yValues = List.copyOf(yValues);
        }

        /** X coordinate of the i-th point. */
        public double xAt(int index) {
            if (yValues.size() < 2) {
                return xScale.min();
            }
            double step = (xScale.max() - xScale.min()) / (yValues.size() - 1);
            return xScale.min() + step * index;
        }
    }

    /** Explicit x/y point pairs. */
    record XYPairs(
            GraphicalFunctionScale xScale,
            GraphicalFunctionScale yScale,
            List<Double> xValues,
            String xSeparator,
            List<Double> yValues,
            String ySeparator)
            implements GraphicalFunctionData {

        public XYPairs {
            xValues = List.copyOf(xValues);
            yValues = List.copyOf(yValues);
        }
    }
}
