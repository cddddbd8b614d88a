package work.stepweave.engine.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Strict JSON reading shared by validators and transforms: trailing content after the document is an error.
 */
public final class JsonDocuments {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonDocuments() {}

    public static JsonNode readTree(String text) throws JsonProcessingException {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("empty document");
        }
        JsonNode node = MAPPER.readTree(text.trim());
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("empty document");
        }
        return node;
    }

    public static Object parse(String text) throws JsonProcessingException {
        return toJava(readTree(text));
    }

    public static Object toJava(JsonNode node) {
        return MAPPER.convertValue(node, Object.class);
    }

    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Message of a parse failure without Jackson's source location suffix.
     */
    public static String describe(Exception ex) {
        if (ex instanceof JsonProcessingException jsonError) {
            var location = jsonError.getLocation();
            var message = jsonError.getOriginalMessage();
            return location == null ? message : message + " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
        }
        return ex.getMessage();
    }
}
