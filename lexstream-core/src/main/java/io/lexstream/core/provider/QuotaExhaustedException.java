package io.lexstream.core.provider;

public final class QuotaExhaustedException extends UpstreamException {
    private final String model;
    private final String body;

    public QuotaExhaustedException(String model, String body) {
        super("Quota exhausted for model " + model);
        this.model = model;
        this.body = body == null ? "" : body;
    }

    public String model() {
        return model;
    }

    public String body() {
        return body;
    }
}
