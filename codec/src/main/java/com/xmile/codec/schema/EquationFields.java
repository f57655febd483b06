package com.xmile.codec.schema;

import java.util.List;

/**
 * Fields shared by stocks, flows and auxiliaries. The equation is null only for arrayed variables
 * that give one equation per element.
 */
public record EquationFields(
        Equation equation,
        String mathml,
        Documentation documentation,
        String units,
        DeviceRange range,
        DeviceScale scale,
        FormatOptions format,
        List<String> dimensions,
        List<ArrayElement> elements,
        GraphicalFunction graphicalFunction,
        EventPoster eventPoster,
        Access access,
        Boolean autoexport) {

    public EquationFields {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static EquationFields of(Equation equation) {
        return new EquationFields(
                equation, null, null, null, null, null, null, List.of(), List.of(), null, null, null,
                null);
    }

    public static EquationFields of(Equation equation, String units) {
        return new EquationFields(
                equation, null, null, units, null, null, null, List.of(), List.of(), null, null, null,
                null);
    }

    public boolean isArrayed() {
        return !dimensions.isEmpty();
    }

    public EquationFields withEquation(Equation newEquation) {
        return new EquationFields(
                newEquation, mathml, documentation, units, range, scale, format, dimensions, elements,
                graphicalFunction, eventPoster, access, autoexport);
    }

    public EquationFields withElements(List<ArrayElement> newElements) {
        return new EquationFields(
                equation, mathml, documentation, units, range, scale, format, dimensions, newElements,
                graphicalFunction, eventPoster, access, autoexport);
    }
}
