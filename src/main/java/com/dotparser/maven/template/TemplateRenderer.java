package com.dotparser.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Renders a named report template against a context map.
 */
public interface TemplateRenderer {
    /**
     * @param templateName path of the template relative to the template roots (e.g. "summary.md.mustache")
     * @param context      values referenced by the template
     * @return the rendered text
     * @throws IOException if the template cannot be found or read
     */
    String render(String templateName, Map<String, Object> context) throws IOException;
}
