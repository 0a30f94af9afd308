package io.chronicle.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChronicleConfig(StorageConfig storage, MigrationConfig migration) {

    public static ChronicleConfig defaults() {
        return new ChronicleConfig(StorageConfig.defaults(), MigrationConfig.defaults());
    }
}
