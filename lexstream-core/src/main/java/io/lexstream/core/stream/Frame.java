package io.lexstream.core.stream;

import java.util.Objects;

public record Frame(String data) {

    public Frame {
        Objects.requireNonNull(data, "data must not be null");
    }
}
