package com.dotparser.maven.report;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link ReportConfig} from YAML.
 */
public class ReportConfigLoader {

    /** Bundled configuration used when the project supplies none. */
    public static final String DEFAULT_RESOURCE = "/dot-report.yml";

    /**
     * Loads configuration from a YAML file.
     */
    public static ReportConfig load(Path configPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return read(inputStream, configPath.toString());
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static ReportConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = ReportConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return read(inputStream, resourcePath);
        }
    }

    public static ReportConfig loadDefault() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    private static ReportConfig read(InputStream inputStream, String origin) throws IOException {
        Object data;
        try {
            data = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new IOException("Malformed report configuration " + origin + ": " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new IOException("Report configuration " + origin + " must be a YAML mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        try {
            return ReportConfig.fromMap(map);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid report configuration " + origin + ": " + e.getMessage(), e);
        }
    }

    private ReportConfigLoader() {
    }
}
