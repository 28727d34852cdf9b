package io.lexstream.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path historyPath,
    boolean createdConfig,
    boolean overwrittenConfig,
    boolean historyExisted
) {
}
