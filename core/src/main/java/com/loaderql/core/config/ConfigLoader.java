package com.loaderql.core.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.loaderql.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a {@link GraphletteConfig} from JSON.
 * <pre>
 * {
 *   "schemaFile": "dogs.graphql",
 *   "cache": 256,
 *   "jit": 1,
 *   "onlyPersisted": false,
 *   "persistedQueries": { "dogs": "{ dogs { name } }" }
 * }
 * </pre>
 * {@code schemaFile} is resolved against the directory of the config file; an inline
 * {@code schema} string may be given instead. Values are handed over untyped so that
 * {@link ConfigValidator} reports bad option types the same way for files and code.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static GraphletteConfig load(Path path) throws IOException {
        logger.debug("Loading graphlette config from {}", path);
        String json = Files.readString(path);
        Path base = path.toAbsolutePath().getParent();
        return parse(json, base);
    }

    public static GraphletteConfig fromJson(String json) {
        return rethrowing(() -> parse(json, null));
    }

    private static GraphletteConfig parse(String json, Path base) throws IOException {
        JsonObject root;
        try {
            root = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new ConfigurationException("Config must be a JSON object", e);
        }

        GraphletteConfig.Builder builder = GraphletteConfig.builder();

        if (root.has("schemaFile")) {
            if (base == null) {
                throw new ConfigurationException("schemaFile needs a config file location, use schema instead");
            }
            builder.schema(Files.readString(base.resolve(string(root.get("schemaFile"), "schemaFile"))));
        } else if (root.has("schema")) {
            builder.schema(string(root.get("schema"), "schema"));
        }

        builder.cache(untyped(root.get("cache")));
        builder.jit(untyped(root.get("jit")));

        JsonElement onlyPersisted = root.get("onlyPersisted");
        if (onlyPersisted != null && !onlyPersisted.isJsonNull()) {
            if (!onlyPersisted.isJsonPrimitive() || !onlyPersisted.getAsJsonPrimitive().isBoolean()) {
                throw new ConfigurationException("onlyPersisted must be a boolean");
            }
            builder.onlyPersisted(onlyPersisted.getAsBoolean());
        }

        JsonElement persisted = root.get("persistedQueries");
        if (persisted != null && !persisted.isJsonNull()) {
            if (!persisted.isJsonObject()) {
                throw new ConfigurationException("persistedQueries must be an object");
            }
            for (Map.Entry<String, JsonElement> entry : persisted.getAsJsonObject().entrySet()) {
                builder.persistedQuery(entry.getKey(), string(entry.getValue(), "persisted query " + entry.getKey()));
            }
        }

        return builder.build();
    }

    private static String string(JsonElement element, String name) {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ConfigurationException(name + " must be a string");
        }
        return element.getAsString();
    }

    private static Object untyped(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            return element;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsNumber();
        }
        return primitive.getAsString();
    }

    private static GraphletteConfig rethrowing(IOSupplier supplier) {
        try {
            return supplier.get();
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read config", e);
        }
    }

    @FunctionalInterface
    private interface IOSupplier {
        GraphletteConfig get() throws IOException;
    }
}
