package ou.capstone.surf.config;

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the static configuration tables (spots, skill ranges, wind curve,
 * monthly averages) from JSON files on the classpath.
 * <p>
 * Resource location: src/main/resources/data/*.json, accessed as "/data/...".
 * A missing or malformed table is a packaging bug, so failures surface as
 * {@link IllegalStateException} rather than a checked exception.
 */
public final class JsonResources {
    private static final Logger logger = LoggerFactory.getLogger(JsonResources.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonResources() {
        // Prevent instantiation
    }

    /**
     * Parses a classpath resource into a JSON tree.
     *
     * @param resourcePath absolute classpath path, e.g. "/data/surf-spots.json"
     * @return the root node
     * @throws IllegalStateException if the resource is missing or not valid JSON
     */
    public static JsonNode read(final String resourcePath) {
        final InputStream is = JsonResources.class.getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("JSON table not found on classpath: " + resourcePath);
        }
        try (InputStream in = is) {
            final JsonNode root = MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new IllegalStateException("Empty JSON table: " + resourcePath);
            }
            logger.debug("Loaded JSON table {}", resourcePath);
            return root;
        } catch (final IOException e) {
            throw new IllegalStateException("Malformed JSON table: " + resourcePath, e);
        }
    }

    /**
     * Returns the named array field, failing if it is absent.
     */
    public static JsonNode requireArray(final JsonNode node, final String field, final String source) {
        final JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new IllegalStateException("Missing array '" + field + "' in " + source);
        }
        return array;
    }

    /**
     * Returns the named numeric field, failing if it is absent or not a number.
     */
    public static double requireDouble(final JsonNode node, final String field, final String source) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalStateException("Missing numeric field '" + field + "' in " + source);
        }
        return value.asDouble();
    }

    /**
     * Returns the named text field, failing if it is absent or blank.
     */
    public static String requireText(final JsonNode node, final String field, final String source) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalStateException("Missing text field '" + field + "' in " + source);
        }
        return value.asText();
    }
}
