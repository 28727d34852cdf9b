package io.lexstream.cli;

import io.lexstream.core.config.ConfigService;
import io.lexstream.core.config.model.LexstreamConfig;
import io.lexstream.core.pipeline.LexstreamRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    Function<LexstreamConfig, LexstreamRuntime> runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, System.getenv(), LexstreamRuntime::create);
    }

    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public LexstreamConfig loadConfig() throws IOException {
        return configService.applyEnvironment(configService.load(configPath), environment);
    }

    public LexstreamRuntime openRuntime() throws IOException {
        return runtimeFactory.apply(loadConfig());
    }
}
