package com.loaderql.api.graphql;

import com.loaderql.core.LoaderQuery;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;

import java.util.concurrent.CompletableFuture;

/**
 * The resolver installed for a loader-backed field. graphql-java calls it once per
 * parent object; each call becomes a registration with the {@link BatchScheduler}.
 */
public class LoaderResolver implements DataFetcher<CompletableFuture<Object>> {
    private final LoaderDeclaration declaration;
    private final BatchScheduler scheduler;

    public LoaderResolver(LoaderDeclaration declaration, BatchScheduler scheduler) {
        this.declaration = declaration;
        this.scheduler = scheduler;
    }

    @Override
    public CompletableFuture<Object> get(DataFetchingEnvironment environment) {
        OperationContext context = OperationContext.from(environment.getGraphQlContext());
        if (context == null) {
            throw new MissingOperationContextException(declaration.name());
        }

        Object source = environment.getSource();
        LoaderQuery query = new LoaderQuery(source, environment.getArguments());
        return scheduler.load(declaration, query, context);
    }
}
