package com.dotparser.maven.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;

/**
 * Loads report templates. A file in the user template directory overrides the
 * template of the same name bundled under {@value #CLASSPATH_ROOT}.
 */
public class TemplateLoader {

    static final String CLASSPATH_ROOT = "/dot-templates/";

    private final Path userTemplateDir;
    private final Log log;

    /**
     * @param userTemplateDir directory with user templates, or {@code null} to use only the bundled ones
     * @param log             plugin logger
     */
    public TemplateLoader(Path userTemplateDir, Log log) {
        this.userTemplateDir = userTemplateDir;
        this.log = log;
    }

    /**
     * @param templatePath relative template path, e.g. "summary.md.mustache"
     * @return template source
     * @throws IOException if neither location has the template
     */
    public String loadTemplate(String templatePath) throws IOException {
        if (userTemplateDir != null) {
            Path userTemplate = userTemplateDir.resolve(templatePath);
            if (Files.isRegularFile(userTemplate)) {
                log.debug("Using user template: " + userTemplate);
                return Files.readString(userTemplate, StandardCharsets.UTF_8);
            }
        }

        String resourcePath = CLASSPATH_ROOT + templatePath;
        try (InputStream inputStream = TemplateLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream != null) {
                log.debug("Using bundled template: " + resourcePath);
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        throw new IOException("Template not found: " + templatePath
                + " (checked user: " + userTemplateDir + ", classpath: " + resourcePath + ")");
    }
}
