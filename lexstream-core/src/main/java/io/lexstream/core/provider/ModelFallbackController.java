package io.lexstream.core.provider;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ModelFallbackController {
    private static final Logger LOG = LoggerFactory.getLogger(ModelFallbackController.class);

    private final String primaryModel;
    private final String fallbackModel;
    private ModelTier tier = ModelTier.PRIMARY;

    public ModelFallbackController(String primaryModel, String fallbackModel) {
        this.primaryModel = Objects.requireNonNull(primaryModel, "primaryModel must not be null");
        this.fallbackModel = Objects.requireNonNull(fallbackModel, "fallbackModel must not be null");
    }

    public synchronized String activeModel() {
        return tier == ModelTier.PRIMARY ? primaryModel : fallbackModel;
    }

    public synchronized ModelTier activeTier() {
        return tier;
    }

    public synchronized void markExhausted() {
        if (tier == ModelTier.PRIMARY) {
            LOG.info("Quota exhausted on {}, switching to {}", primaryModel, fallbackModel);
        }
        tier = ModelTier.FALLBACK;
    }

    public synchronized void reset() {
        tier = ModelTier.PRIMARY;
    }
}
