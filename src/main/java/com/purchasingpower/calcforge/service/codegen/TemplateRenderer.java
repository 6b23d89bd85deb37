package com.purchasingpower.calcforge.service.codegen;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.calcforge.exception.TemplateRenderingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Loads generator resources from the classpath.
 *
 * <p>Templates live under {@code templates/} and are rendered with Mustache; files that
 * need no variables live under {@code generator/static/} and are copied as-is.
 * Use triple braces in templates for source code, since double braces HTML-escape.
 */
@Slf4j
@Component
public class TemplateRenderer {

    static final String TEMPLATE_ROOT = "templates";
    static final String STATIC_ROOT = "generator/static/";

    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory(TEMPLATE_ROOT);

    public String render(String templateName, Map<String, Object> variables) {
        try {
            Mustache mustache = mustacheFactory.compile(templateName + ".mustache");
            StringWriter writer = new StringWriter();
            mustache.execute(writer, variables);
            return writer.toString();
        } catch (MustacheException e) {
            throw new TemplateRenderingException("Failed to render template " + templateName, templateName, e);
        }
    }

    /**
     * Contents of a static generator file, e.g. {@code src/lib/calculations/runtime.ts}.
     */
    public String copy(String path) {
        ClassPathResource resource = new ClassPathResource(STATIC_ROOT + path);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateRenderingException("Missing static generator file " + path, path, e);
        }
    }
}
