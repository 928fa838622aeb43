package com.viewstack.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

/**
 * Reads the {@code views.yaml} of a rendering run.
 */
public class ViewConfigLoader {

    /**
     * Loads the view configuration. An empty file gives the defaults.
     *
     * @throws IOException if the file cannot be read or its top level is not a mapping
     */
    @SuppressWarnings("unchecked")
    public static ViewConfig load(Path configPath) throws IOException {
        Object data;
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            data = new Yaml().load(inputStream);
        }
        if (data != null && !(data instanceof Map)) {
            throw new IOException("View configuration must be a YAML mapping: " + configPath);
        }
        return ViewConfig.fromMap((Map<String, Object>) data);
    }
}
