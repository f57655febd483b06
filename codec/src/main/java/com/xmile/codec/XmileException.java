package com.xmile.codec;

import com.xmile.codec.validation.ValidationMessage;
import java.util.List;
import java.util.Objects;

/** Failure of a decode, encode or validation call, with the position it refers to. */
public final class XmileException extends Exception {

    public enum Kind {
        IO,
        XML,
        DESERIALIZE,
        SERIALIZE,
        VALIDATION,
        MULTIPLE
    }

    private final Kind kind;
    private final String detail;
    private final ErrorContext context;
    private final List<ValidationMessage> warnings;
    private final List<ValidationMessage> errors;
    private final List<XmileException> causes;

    public XmileException(Kind kind, String detail, ErrorContext context) {
        this(kind, detail, context, null, List.of(), List.of(), List.of());
    }

    public XmileException(Kind kind, String detail, ErrorContext context, Throwable cause) {
        this(kind, detail, context, cause, List.of(), List.of(), List.of());
    }

    private XmileException(
            Kind kind,
            String detail,
            ErrorContext context,
            Throwable cause,
            List<ValidationMessage> warnings,
            List<ValidationMessage> errors,
            List<XmileException> causes) {
        super(detail + (context == null ? "" : context.display()), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
        this.context = context == null ? ErrorContext.none() : context;
        this.warnings = List.copyOf(warnings);
        this.errors = List.copyOf(errors);
        this.causes = List.copyOf(causes);
    }

    public static XmileException validation(
            String detail, List<ValidationMessage> warnings, List<ValidationMessage> errors) {
        return new XmileException(
                Kind.VALIDATION, detail, ErrorContext.none(), null, warnings, errors, List.of());
    }

    static XmileException multiple(List<XmileException> causes) {
        StringBuilder detail = new StringBuilder(causes.size() + " errors occurred:");
        for (int i = 0; i < causes.size(); i++) {
            detail.append("\n  ").append(i + 1).append(". ").append(causes.get(i).getMessage());
        }
        XmileException result =
                new XmileException(
                        Kind.MULTIPLE,
                        detail.toString(),
                        ErrorContext.none(),
                        null,
                        List.of(),
                        List.of(),
                        causes);
        for (XmileException cause : causes) {
            result.addSuppressed(cause);
        }
        return result;
    }

    public Kind getKind() {
        return kind;
    }

    /** Message without the position suffix. */
    public String getDetail() {
        return detail;
    }

    public ErrorContext getContext() {
        return context;
    }

    public List<ValidationMessage> getWarnings() {
        return warnings;
    }

    public List<ValidationMessage> getErrors() {
        return errors;
    }

    /** The aggregated failures of a {@link Kind#MULTIPLE} exception. */
    public List<XmileException> getCauses() {
        return causes;
    }
}
