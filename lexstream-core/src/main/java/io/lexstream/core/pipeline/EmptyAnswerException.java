package io.lexstream.core.pipeline;

public final class EmptyAnswerException extends RuntimeException {
    private final String model;

    public EmptyAnswerException(String model) {
        super("Model " + model + " returned no answer text");
        this.model = model;
    }

    public String model() {
        return model;
    }
}
