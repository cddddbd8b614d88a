package work.stepweave.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.stepweave.engine.error.ErrorKind;
import work.stepweave.engine.error.WorkflowException;

/**
 * Evaluation scope of one step sequence: caller input, results of the steps completed so far and loop
 * variables. A context is owned by the thread running its sequence; nested sequences and parallel collection
 * elements each get their own copy, so step results written there never leak into the parent.
 */
public final class ExecutionContext {
    public static final Set<String> RESERVED_NAMES = Set.of("input", "steps", "workflow");

    private final RunSession session;
    private final Map<String, Object> input;
    private final Map<String, Object> steps;
    private final Map<String, Object> variables;
    private final CancellationToken cancellationToken;

    private ExecutionContext(
        RunSession session,
        Map<String, Object> input,
        Map<String, Object> steps,
        Map<String, Object> variables,
        CancellationToken cancellationToken
    ) {
        this.session = session;
        this.input = input;
        this.steps = steps;
        this.variables = variables;
        this.cancellationToken = cancellationToken;
    }

    public static ExecutionContext root(RunSession session, Map<String, Object> input) {
        Objects.requireNonNull(session, "session");
        var frozenInput = Collections.unmodifiableMap(new LinkedHashMap<>(input == null ? Map.of() : input));
        return new ExecutionContext(session, frozenInput, new LinkedHashMap<>(), Map.of(), session.cancellationToken());
    }

    public RunSession session() {
        return session;
    }

    public Map<String, Object> input() {
        return input;
    }

    public Map<String, Object> steps() {
        return Collections.unmodifiableMap(steps);
    }

    public Object variable(String name) {
        return variables.get(name);
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /**
     * Scope for a nested sequence: sees everything this one sees; its own step results stay local.
     */
    public ExecutionContext nested() {
        return new ExecutionContext(session, input, new LinkedHashMap<>(steps), variables, cancellationToken);
    }

    public ExecutionContext withVariables(Map<String, Object> extra) {
        var merged = new LinkedHashMap<>(variables);
        merged.putAll(extra);
        return new ExecutionContext(session, input, new LinkedHashMap<>(steps), Collections.unmodifiableMap(merged), cancellationToken);
    }

    public ExecutionContext withCancellationToken(CancellationToken token) {
        return new ExecutionContext(session, input, new LinkedHashMap<>(steps), variables, Objects.requireNonNull(token, "token"));
    }

    public void putStepResult(String stepId, Object result) {
        steps.put(stepId, result);
    }

    /**
     * Names visible to templates. Input keys are also exposed at top level unless a reserved name or a loop
     * variable shadows them.
     */
    public Map<String, Object> bindings() {
        var bindings = new LinkedHashMap<String, Object>();
        input.forEach((key, value) -> {
            if (!RESERVED_NAMES.contains(key) && !variables.containsKey(key)) {
                bindings.put(key, value);
            }
        });
        bindings.put("input", input);
        bindings.put("steps", steps);
        bindings.put("workflow", Map.of("name", session.workflowName()));
        bindings.putAll(variables);
        return bindings;
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new ExecutionCancelledException("Execution cancelled");
        }
    }

    /**
     * Cooperative cancellation flag. A child token also reports cancellation of its parent.
     */
    public static final class CancellationToken {
        private final CancellationToken parent;
        private volatile boolean cancelled = false;

        public CancellationToken() {
            this(null);
        }

        private CancellationToken(CancellationToken parent) {
            this.parent = parent;
        }

        public CancellationToken child() {
            return new CancellationToken(this);
        }

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled || (parent != null && parent.isCancelled());
        }
    }

    public static final class ExecutionCancelledException extends WorkflowException {
        public ExecutionCancelledException(String message) {
            super(ErrorKind.CANCELLED, message);
        }
    }
}
