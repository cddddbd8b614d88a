package work.stepweave.engine.provider;

public record ProviderResponse(String text, FinishReason finishReason, Usage usage) {
    public ProviderResponse {
        text = text == null ? "" : text;
        finishReason = finishReason == null ? FinishReason.STOP : finishReason;
        usage = usage == null ? Usage.ZERO : usage;
    }

    public static ProviderResponse stop(String text, Usage usage) {
        return new ProviderResponse(text, FinishReason.STOP, usage);
    }
}
