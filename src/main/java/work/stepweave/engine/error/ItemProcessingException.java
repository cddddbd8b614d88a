package work.stepweave.engine.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element-level failure inside a collection step. When it escapes the collection it lists every per-index error.
 */
public final class ItemProcessingException extends WorkflowException {
    private final int index;
    private final List<Map<String, Object>> itemErrors;

    public ItemProcessingException(int index, String message, Throwable cause) {
        this(index, message, List.of(), cause);
    }

    public ItemProcessingException(int index, String message, List<Map<String, Object>> itemErrors, Throwable cause) {
        super(ErrorKind.ITEM_PROCESSING, message, null, details(index, itemErrors), cause);
        this.index = index;
        this.itemErrors = itemErrors == null ? List.of() : List.copyOf(itemErrors);
    }

    public int index() {
        return index;
    }

    public List<Map<String, Object>> itemErrors() {
        return itemErrors;
    }

    private static Map<String, Object> details(int index, List<Map<String, Object>> itemErrors) {
        var details = new LinkedHashMap<String, Object>();
        details.put("index", index);
        if (itemErrors != null && !itemErrors.isEmpty()) {
            details.put("errors", List.copyOf(itemErrors));
        }
        return details;
    }
}
