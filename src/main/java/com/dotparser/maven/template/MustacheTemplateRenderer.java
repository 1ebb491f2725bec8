package com.dotparser.maven.template;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;

/**
 * Mustache renderer. Each template is loaded and compiled once per renderer,
 * since one goal execution renders the same template for every graph.
 */
public class MustacheTemplateRenderer implements TemplateRenderer {

    private final TemplateLoader templateLoader;
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, Mustache> compiled = new HashMap<>();

    public MustacheTemplateRenderer(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            String source = templateLoader.loadTemplate(templateName);
            mustache = mustacheFactory.compile(new StringReader(source), templateName);
            compiled.put(templateName, mustache);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, context).flush();
        return writer.toString();
    }
}
