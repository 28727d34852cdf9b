package io.lexstream.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"history_path"}) String historyPath) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.lexstream/history/turns.json");
    }
}
