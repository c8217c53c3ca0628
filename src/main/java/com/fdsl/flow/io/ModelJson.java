package com.fdsl.flow.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson binding for the metamodel JSON emitted by the FDSL parser.
 */
public final class ModelJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private ModelJson() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Parses a metamodel file. */
    public static ModelDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ModelDefinition.class);
        }
    }

    /** Parses a metamodel from a JSON string. */
    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed model definition", e);
        }
    }

    /** Parses a metamodel bundled as a classpath resource. */
    public static ModelDefinition parseResource(String resource) {
        InputStream in = ModelJson.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new IllegalArgumentException("Model resource not found: " + resource);
        try (in) {
            return MAPPER.readValue(in, ModelDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed model resource " + resource, e);
        }
    }

    public static String write(ModelDefinition def) {
        try {
            return MAPPER.writeValueAsString(def);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
