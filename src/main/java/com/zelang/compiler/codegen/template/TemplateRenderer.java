package com.zelang.compiler.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.codegen.CodeGenerationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the C templates under {@code /templates} on the classpath. Safe to
 * share; holds no per-program state.
 */
public class TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private final Configuration freemarkerConfig;

    public TemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        // port numbers and buffer sizes must not get grouping separators
        cfg.setNumberFormat("computer");
        return cfg;
    }

    public String render(String templateName, Map<String, Object> model) {
        StringWriter out = new StringWriter();
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            template.process(model, out);
        } catch (IOException | TemplateException e) {
            throw new CodeGenerationException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
        log.trace("Rendered {} ({} chars)", templateName, out.getBuffer().length());
        return out.toString();
    }
}
