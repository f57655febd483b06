package com.xmile.codec.schema;

import java.util.List;

public record Data(List<DataImport> imports, List<DataExport> exports) {

    public Data {
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
    }
}
