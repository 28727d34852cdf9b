package io.lexstream.core.provider;

public enum ModelTier {
    PRIMARY,
    FALLBACK
}
