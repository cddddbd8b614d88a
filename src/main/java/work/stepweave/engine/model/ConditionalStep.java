package work.stepweave.engine.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects at most one branch to run. The basic {@code condition/if_true/if_false} form is stored as an
 * {@code if_true} branch followed by an optional default {@code if_false} branch.
 */
public record ConditionalStep(
    String id,
    String description,
    OnError onError,
    List<ConditionalBranch> branches,
    OnError onConditionError,
    boolean basicForm
) implements Step {
    public static final String TYPE = "conditional";
    public static final String IF_TRUE = "if_true";
    public static final String IF_FALSE = "if_false";

    public ConditionalStep {
        Objects.requireNonNull(id, "id");
        branches = branches == null ? List.of() : List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("conditional step requires at least one branch");
        }
        onError = onError == null ? OnError.STOP : onError;
        onConditionError = onConditionError == null ? OnError.STOP : onConditionError;
    }

    @Override
    public String type() {
        return TYPE;
    }

    public List<ConditionalBranch> conditionalBranches() {
        return branches.stream().filter(branch -> !branch.isDefault()).toList();
    }

    public Optional<ConditionalBranch> defaultBranch() {
        return branches.stream().filter(ConditionalBranch::isDefault).findFirst();
    }
}
