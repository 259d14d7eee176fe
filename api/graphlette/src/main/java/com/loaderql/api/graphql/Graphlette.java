package com.loaderql.api.graphql;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.loaderql.core.LoaderOptions;
import com.loaderql.core.config.ConfigValidator;
import com.loaderql.core.config.GraphletteConfig;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.ExecutionResultImpl;
import graphql.GraphQL;
import graphql.GraphqlErrorBuilder;
import graphql.language.FieldDefinition;
import graphql.language.ObjectTypeDefinition;
import graphql.language.TypeDefinition;
import graphql.schema.DataFetcher;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A GraphQL endpoint whose fields may be backed by batch loaders.
 * <p>
 * {@link #executeRequest} (and {@link #doPost}, {@link #executeInternal} on top of it)
 * establishes a fresh {@link OperationContext} per operation; {@link #evaluate} does not,
 * so loader-backed fields fail there.
 */
public class Graphlette extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(Graphlette.class);
    private static final Gson gson = new GsonBuilder().serializeNulls().create();
    private static final String MISSING_QUERY = "Missing query";
    private static final String PERSISTED_QUERY_NOT_FOUND = "persisted query not found";

    private final TypeDefinitionRegistry typeDefinitionRegistry;
    private final Map<FieldCoordinates, DataFetcher<?>> resolvers;
    private final LoaderRegistry loaderRegistry = new LoaderRegistry();
    private final BatchScheduler scheduler = new BatchScheduler();
    private final QueryCache queryCache;
    private final boolean onlyPersisted;
    private final Map<String, String> persistedQueries;
    private volatile GraphQL graphQL;

    Graphlette(
            GraphletteConfig config,
            Map<FieldCoordinates, DataFetcher<?>> resolvers,
            Map<FieldCoordinates, LoaderDefinition> loaders
    ) {
        ConfigValidator.validate(config);

        SchemaParser schemaParser = new SchemaParser();
        this.typeDefinitionRegistry = schemaParser.parse(config.schema());
        this.resolvers = Map.copyOf(resolvers);
        this.onlyPersisted = config.onlyPersisted();
        this.persistedQueries = config.persistedQueries() == null ? Map.of() : Map.copyOf(config.persistedQueries());

        int cacheSize = ConfigValidator.cacheSize(config.cache());
        this.queryCache = cacheSize > 0
                ? new QueryCache(cacheSize, ConfigValidator.jitThreshold(config.jit()))
                : null;

        this.resolvers.keySet().forEach(this::checkField);
        loaders.forEach((coordinates, definition) -> {
            checkField(coordinates);
            loaderRegistry.register(coordinates.getTypeName(), coordinates.getFieldName(), definition);
        });

        rebuild();
    }

    public static Builder newGraphlette() {
        return new Builder();
    }

    /**
     * Merges loader declarations into the running graphlette. Operations already executing
     * keep the resolvers they started with; later operations see the new ones. Declaring
     * the same loaders again is a no-op.
     *
     * @param loaders type name to field name to loader
     * @return {@code true} if any declaration changed
     */
    public synchronized boolean defineLoaders(Map<String, Map<String, LoaderDefinition>> loaders) {
        loaders.forEach((typeName, fields) ->
                fields.keySet().forEach(fieldName -> checkField(FieldCoordinates.coordinates(typeName, fieldName))));

        boolean changed = false;
        for (Map.Entry<String, Map<String, LoaderDefinition>> type : loaders.entrySet()) {
            for (Map.Entry<String, LoaderDefinition> field : type.getValue().entrySet()) {
                changed |= loaderRegistry.register(type.getKey(), field.getKey(), field.getValue());
            }
        }

        if (changed) {
            rebuild();
        } else {
            logger.debug("defineLoaders made no changes");
        }
        return changed;
    }

    public LoaderRegistry getLoaderRegistry() {
        return loaderRegistry;
    }

    /**
     * Executes one operation inside its own {@link OperationContext}. Field errors are
     * returned in the result, never thrown.
     */
    public ExecutionResult executeRequest(GraphQLRequest request, HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        GraphQL snapshot = graphQL;

        if (request.query() == null) {
            return errorResult(MISSING_QUERY);
        }
        Optional<String> query = resolveQuery(request.query());
        if (query.isEmpty()) {
            return errorResult(PERSISTED_QUERY_NOT_FOUND);
        }

        try (OperationContext context = new OperationContext(this, httpRequest, httpResponse)) {
            ExecutionInput input = ExecutionInput.newExecutionInput()
                    .query(query.get())
                    .operationName(request.operationName())
                    .variables(request.variables() == null ? Map.of() : request.variables())
                    .dataLoaderRegistry(context.getDataLoaderRegistry())
                    .graphQLContext(Map.of(OperationContext.class, context))
                    .build();

            return snapshot.execute(input);
        }
    }

    /**
     * Execute a GraphQL query internally without HTTP overhead.
     * Loaders work here; the batch functions see no request or response.
     *
     * @param query The GraphQL query string
     * @return The JSON response as a string
     */
    public String executeInternal(String query) {
        ExecutionResult result = executeRequest(GraphQLRequest.of(query), null, null);
        return gson.toJson(result.toSpecification());
    }

    /**
     * Executes without establishing an operation scope and fails on any error.
     *
     * @return the {@code data} of the result
     * @throws GraphQLAggregateException carrying every error when execution produced any
     */
    public <T> T evaluate(String query, Map<String, Object> variables) {
        if (query == null) {
            throw new GraphQLAggregateException(
                    GraphQLAggregateException.BAD_REQUEST,
                    errorResult(MISSING_QUERY).getErrors(),
                    null
            );
        }
        Optional<String> resolved = resolveQuery(query);
        if (resolved.isEmpty()) {
            throw new GraphQLAggregateException(
                    GraphQLAggregateException.BAD_REQUEST,
                    errorResult(PERSISTED_QUERY_NOT_FOUND).getErrors(),
                    null
            );
        }

        ExecutionInput input = ExecutionInput.newExecutionInput()
                .query(resolved.get())
                .variables(variables == null ? Map.of() : variables)
                .build();

        ExecutionResult result = graphQL.execute(input);
        if (!result.getErrors().isEmpty()) {
            logger.debug("Evaluation failed with {} errors", result.getErrors().size());
            throw new GraphQLAggregateException(
                    result.getData() == null
                            ? GraphQLAggregateException.BAD_REQUEST
                            : GraphQLAggregateException.INTERNAL_SERVER_ERROR,
                    result.getErrors(),
                    result.getData()
            );
        }
        return result.getData();
    }

    public <T> T evaluate(String query) {
        return evaluate(query, null);
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setContentType("application/json");

        GraphQLRequest graphQLRequest;
        try {
            String body = request.getReader().lines().collect(Collectors.joining());
            graphQLRequest = gson.fromJson(body, GraphQLRequest.class);
        } catch (JsonParseException e) {
            response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
            response.getWriter().write(gson.toJson(new ErrorResponse("Invalid GraphQL request: " + e.getMessage())));
            return;
        }

        if (graphQLRequest == null || graphQLRequest.query() == null) {
            response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
            response.getWriter().write(gson.toJson(new ErrorResponse(MISSING_QUERY)));
            return;
        }

        try {
            ExecutionResult result = executeRequest(graphQLRequest, request, response);
            response.setStatus(HttpServletResponse.SC_OK);
            response.getWriter().write(gson.toJson(result.toSpecification()));
        } catch (RuntimeException e) {
            logger.error("Error processing GraphQL request", e);
            response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            response.getWriter().write(gson.toJson(new ErrorResponse("Error processing GraphQL request: " + e.getMessage())));
        }
    }

    private synchronized void rebuild() {
        RuntimeWiring.Builder builder = RuntimeWiring.newRuntimeWiring();

        resolvers.forEach((coordinates, fetcher) ->
                builder.type(coordinates.getTypeName(), b -> b.dataFetcher(coordinates.getFieldName(), fetcher)));

        // Loader resolvers win over plain resolvers for the same field
        for (LoaderDeclaration declaration : loaderRegistry.declarations()) {
            FieldCoordinates coordinates = declaration.coordinates();
            LoaderResolver resolver = new LoaderResolver(declaration, scheduler);
            builder.type(coordinates.getTypeName(), b -> b.dataFetcher(coordinates.getFieldName(), resolver));
        }

        SchemaGenerator schemaGenerator = new SchemaGenerator();
        GraphQLSchema graphQLSchema = schemaGenerator.makeExecutableSchema(typeDefinitionRegistry, builder.build());

        GraphQL.Builder graphQLBuilder = GraphQL.newGraphQL(graphQLSchema)
                .defaultDataFetcherExceptionHandler(new LoaderExceptionHandler());
        if (queryCache != null) {
            graphQLBuilder.preparsedDocumentProvider(queryCache);
        }

        this.graphQL = graphQLBuilder.build();
        logger.debug("Built schema with {} resolvers and {} loaders", resolvers.size(), loaderRegistry.size());
    }

    private void checkField(FieldCoordinates coordinates) {
        String typeName = coordinates.getTypeName();
        Optional<TypeDefinition> type = typeDefinitionRegistry.getType(typeName);
        if (type.isEmpty() || !(type.get() instanceof ObjectTypeDefinition)) {
            throw new SchemaReferenceException("Cannot find type " + typeName);
        }

        List<FieldDefinition> fields = new ArrayList<>(((ObjectTypeDefinition) type.get()).getFieldDefinitions());
        typeDefinitionRegistry.objectTypeExtensions()
                .getOrDefault(typeName, List.of())
                .forEach(extension -> fields.addAll(extension.getFieldDefinitions()));

        boolean found = fields.stream().anyMatch(f -> f.getName().equals(coordinates.getFieldName()));
        if (!found) {
            throw new SchemaReferenceException("Cannot find field " + coordinates.getFieldName() + " of type " + typeName);
        }
    }

    private Optional<String> resolveQuery(String query) {
        String persisted = persistedQueries.get(query);
        if (persisted != null) {
            return Optional.of(persisted);
        }
        if (onlyPersisted) {
            logger.debug("Refused non-persisted query");
            return Optional.empty();
        }
        return Optional.of(query);
    }

    private static ExecutionResult errorResult(String message) {
        return ExecutionResultImpl.newExecutionResult()
                .addError(GraphqlErrorBuilder.newError().message(message).build())
                .build();
    }

    public static class Builder {
        private final GraphletteConfig.Builder config = GraphletteConfig.builder();
        private GraphletteConfig fromConfig;
        private final Map<FieldCoordinates, DataFetcher<?>> resolvers = new LinkedHashMap<>();
        private final Map<FieldCoordinates, LoaderDefinition> loaders = new LinkedHashMap<>();

        public Builder schema(String schema) {
            this.config.schema(schema);
            return this;
        }

        public Builder cache(Object cache) {
            this.config.cache(cache);
            return this;
        }

        public Builder jit(Object jit) {
            this.config.jit(jit);
            return this;
        }

        public Builder onlyPersisted(boolean onlyPersisted) {
            this.config.onlyPersisted(onlyPersisted);
            return this;
        }

        public Builder persistedQuery(String id, String query) {
            this.config.persistedQuery(id, query);
            return this;
        }

        /**
         * Use a complete config, e.g. one read by {@link com.loaderql.core.config.ConfigLoader}.
         * Replaces anything set through the individual option methods.
         */
        public Builder config(GraphletteConfig config) {
            this.fromConfig = config;
            return this;
        }

        public Builder resolver(String typeName, String fieldName, DataFetcher<?> resolver) {
            this.resolvers.put(FieldCoordinates.coordinates(typeName, fieldName), resolver);
            return this;
        }

        public Builder loader(String typeName, String fieldName, BatchFunction loader) {
            return loader(typeName, fieldName, LoaderDefinition.of(loader));
        }

        public Builder loader(String typeName, String fieldName, BatchFunction loader, LoaderOptions opts) {
            return loader(typeName, fieldName, LoaderDefinition.of(loader, opts));
        }

        public Builder loader(String typeName, String fieldName, LoaderDefinition definition) {
            this.loaders.put(FieldCoordinates.coordinates(typeName, fieldName), definition);
            return this;
        }

        public Builder loaders(Map<String, Map<String, LoaderDefinition>> loaders) {
            loaders.forEach((typeName, fields) -> fields.forEach((fieldName, definition) ->
                    loader(typeName, fieldName, definition)));
            return this;
        }

        public Graphlette build() {
            GraphletteConfig resolved = fromConfig != null ? fromConfig : config.build();
            return new Graphlette(resolved, resolvers, loaders);
        }
    }

    private record ErrorResponse(String error) {
    }
}
