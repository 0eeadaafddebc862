package com.zelang.compiler.codegen;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.codegen.context.GenerationContext;
import com.zelang.compiler.codegen.context.GeneratorConfig;
import com.zelang.compiler.codegen.context.ProgramClassifier;
import com.zelang.compiler.codegen.model.StructModel;
import com.zelang.compiler.codegen.model.WebModel;
import com.zelang.compiler.codegen.template.TemplateModels;
import com.zelang.compiler.codegen.template.TemplateRenderer;
import com.zelang.compiler.model.Program;

/**
 * Translates a parsed program into one self-contained C source file backed by
 * SQLite and, when the program declares a page or handler, served over HTTP by
 * libmicrohttpd.
 *
 * Output order:
 * - Headers and globals
 * - One typedef per struct
 * - CRUD functions per struct
 * - Web section, or the console demo {@code main}
 *
 * Output is a pure function of the program and the config.
 */
public class CGenerator {
    private static final Logger log = LoggerFactory.getLogger(CGenerator.class);

    private static final String[] CRUD_TEMPLATES = {
        "crud_init_table.ftl",
        "crud_create.ftl",
        "crud_find.ftl",
        "crud_all.ftl",
        "crud_delete.ftl"
    };

    private final GeneratorConfig config;
    private final TemplateRenderer renderer;

    public CGenerator() {
        this(GeneratorConfig.defaults());
    }

    public CGenerator(GeneratorConfig config) {
        this(config, new TemplateRenderer());
    }

    public CGenerator(GeneratorConfig config, TemplateRenderer renderer) {
        this.config = config;
        this.renderer = renderer;
    }

    /**
     * @throws CodeGenerationException if a template fails; nothing is returned in that case
     */
    public String generate(Program program) {
        return generate(ProgramClassifier.classify(program, config));
    }

    /**
     * Generates from an already classified program. Settings come from the
     * context's config, not the one this generator was built with.
     *
     * @throws CodeGenerationException if a template fails; nothing is returned in that case
     */
    public String generate(GenerationContext context) {
        GeneratorConfig config = context.getConfig();
        TemplateModels models = new TemplateModels(context);
        boolean web = context.isWebMode();

        StringBuilder out = new StringBuilder();
        out.append(renderer.render("header.ftl", Map.of("web", web)));

        for (StructModel struct : models.getStructs()) {
            out.append(renderer.render("struct_def.ftl", Map.of("struct", struct)));
        }

        for (StructModel struct : models.getStructs()) {
            Map<String, Object> model = Map.of("struct", struct, "listCapacity", config.getListInitialCapacity());
            for (String template : CRUD_TEMPLATES) {
                out.append(renderer.render(template, model));
            }
        }

        if (web) {
            WebModel webModel = models.webModel();
            out.append(renderer.render("html_chrome.ftl", Map.of()));
            if (webModel.getPage() != null) {
                out.append(renderer.render("html_page.ftl", Map.of("page", webModel.getPage())));
            }
            out.append(renderer.render("http_handler.ftl", Map.of("web", webModel)));
            out.append(renderer.render("web_main.ftl", Map.of("web", webModel)));
        } else {
            out.append(renderer.render("demo_main.ftl", Map.of("demo", models.demoModel())));
        }

        log.debug("Generated {} chars of C for {} struct(s) (web mode {})",
                out.length(), models.getStructs().size(), web);
        return out.toString();
    }
}
