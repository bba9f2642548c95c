package pacer.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import pacer.spi.StorageAdapterConfig;

/**
 * MicroProfile Config implementation of StorageAdapterConfig.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class);
    }

    @Override
    public Optional<Integer> getInt(String key) {
        return config.getOptionalValue(key, Integer.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return config.getOptionalValue(key, Boolean.class);
    }
}
