package com.xmile.codec.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of a decoded {@code <xmile>} file. The model and macro lists are live and may be edited in
 * place.
 */
public final class XmileDocument {

    public static final String DEFAULT_VERSION = "1.0";
    public static final String XMILE_NAMESPACE = "http://docs.oasis-open.org/xmile/ns/XMILE/v1.0";

    private String version;
    private String xmlns;
    private Header header;
    private SimSpecs simSpecs;
    private ModelUnits modelUnits;
    private Dimensions dimensions;
    private Behavior behavior;
    private Data data;
    private final List<Model> models = new ArrayList<>();
    private final List<Macro> macros = new ArrayList<>();

    public XmileDocument(Header header) {
        this(DEFAULT_VERSION, XMILE_NAMESPACE, header);
    }

    public XmileDocument(String version, String xmlns, Header header) {
        this.version = version;
        this.xmlns = xmlns;
        this.header = Objects.requireNonNull(header, "header");
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getXmlns() {
        return xmlns;
    }

    public void setXmlns(String xmlns) {
        this.xmlns = xmlns;
    }

    public Header getHeader() {
        return header;
    }

    public void setHeader(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public SimSpecs getSimSpecs() {
        return simSpecs;
    }

    public void setSimSpecs(SimSpecs simSpecs) {
        this.simSpecs = simSpecs;
    }

    public ModelUnits getModelUnits() {
        return modelUnits;
    }

    public void setModelUnits(ModelUnits modelUnits) {
        this.modelUnits = modelUnits;
    }

    public Dimensions getDimensions() {
        return dimensions;
    }

    public void setDimensions(Dimensions dimensions) {
        this.dimensions = dimensions;
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public void setBehavior(Behavior behavior) {
        this.behavior = behavior;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public List<Model> getModels() {
        return models;
    }

    public List<Macro> getMacros() {
        return macros;
    }

    /** The model without a name, or the first model when every model is named. */
    public Model getRootModel() {
        for (Model model : models) {
            if (model.isRoot()) {
                return model;
            }
        }
        return models.isEmpty() ? null : models.get(0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof XmileDocument other)) {
            return false;
        }
        return Objects.equals(version, other.version)
                && Objects.equals(xmlns, other.xmlns)
                && header.equals(other.header)
                && Objects.equals(simSpecs, other.simSpecs)
                && Objects.equals(modelUnits, other.modelUnits)
                && Objects.equals(dimensions, other.dimensions)
                && Objects.equals(behavior, other.behavior)
                && Objects.equals(data, other.data)
                && models.equals(other.models)
                && macros.equals(other.macros);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                version, xmlns, header, simSpecs, modelUnits, dimensions, behavior, data, models,
                macros);
    }

    @Override
    public String toString() {
        return "XmileDocument(" + header.vendor() + ", " + models.size() + " models)";
    }
}
