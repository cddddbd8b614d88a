package work.stepweave.engine.validation;

import java.util.Map;

/**
 * Named check applied to a provider answer by {@code custom_validator}. Implementations must not throw for
 * bad output; they report it through {@link ValidationOutcome#failure}.
 */
@FunctionalInterface
public interface OutputCheck {
    ValidationOutcome check(String output, Map<String, Object> criteria);
}
