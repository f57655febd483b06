package com.xmile.codec;

/**
 * Where a failure happened: source file, position and the element being read. Every part is
 * optional and omitted from {@link #display()} when unknown.
 */
public record ErrorContext(String filePath, Integer line, Integer column, String stage) {

    public static ErrorContext none() {
        return new ErrorContext(null, null, null, null);
    }

    public static ErrorContext stage(String stage) {
        return new ErrorContext(null, null, null, stage);
    }

    public ErrorContext withFilePath(String path) {
        return new ErrorContext(path, line, column, stage);
    }

    public boolean isEmpty() {
        return filePath == null && line == null && column == null && stage == null;
    }

    /** Suffix appended to error messages, such as {@code in file 'a.xmile', at line 3, column 7}. */
    public String display() {
        StringBuilder out = new StringBuilder();
        if (filePath != null) {
            out.append(" in file '").append(filePath).append('\'');
        }
        if (line != null) {
            out.append(out.length() > 0 ? ", at line " : " at line ").append(line);
            if (column != null) {
                out.append(", column ").append(column);
            }
        }
        if (stage != null) {
            out.append(out.length() > 0 ? ", while parsing " : " while parsing ").append(stage);
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return display();
    }
}
