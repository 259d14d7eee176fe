package com.loaderql.api.graphql;

import java.util.Map;

public record GraphQLRequest(
        String query,
        Map<String, Object> variables,
        String operationName
) {
    public static GraphQLRequest of(String query) {
        return new GraphQLRequest(query, null, null);
    }
}
