package com.loaderql.api.graphql;

import com.loaderql.core.LoaderOptions;
import graphql.schema.FieldCoordinates;

public record LoaderDeclaration(
        FieldCoordinates coordinates,
        BatchFunction batchFunction,
        LoaderOptions options
) {
    public String name() {
        return coordinates.getTypeName() + "." + coordinates.getFieldName();
    }
}
