package com.zelang.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.codegen.CGenerator;
import com.zelang.compiler.codegen.CodeGenerationException;
import com.zelang.compiler.codegen.context.GenerationContext;
import com.zelang.compiler.codegen.context.GeneratorConfig;
import com.zelang.compiler.codegen.context.ProgramClassifier;
import com.zelang.compiler.model.Program;
import com.zelang.compiler.parser.ParseResult;
import com.zelang.compiler.parser.ZeParser;
import com.zelang.compiler.parser.ZeTokenizer;

/**
 * Source text in, C source out. Parse diagnostics are reported but do not stop
 * generation; whatever parsed cleanly is compiled.
 */
public class ZeLangCompiler {
    private static final Logger log = LoggerFactory.getLogger(ZeLangCompiler.class);

    private static final String ANONYMOUS_SOURCE = "<input>";

    private final GeneratorConfig config;
    private final CGenerator generator;

    public ZeLangCompiler() {
        this(GeneratorConfig.defaults());
    }

    public ZeLangCompiler(GeneratorConfig config) {
        this.config = config;
        this.generator = new CGenerator(config);
    }

    public CompilationResult compile(String source) {
        return compile(source, ANONYMOUS_SOURCE);
    }

    public CompilationResult compile(String source, String sourceName) {
        log.info("Parsing {}", sourceName);
        ParseResult parsed = new ZeParser(new ZeTokenizer(source)).parseProgram();
        if (parsed.hasErrors()) {
            log.warn("{}: {} parse diagnostic(s)", sourceName, parsed.getDiagnostics().size());
        }

        Program program = parsed.getProgram();
        GenerationContext context = ProgramClassifier.classify(program, config);

        String generated;
        try {
            log.info("Generating C for {} ({} declaration(s))", sourceName, program.getDeclarations().size());
            generated = generator.generate(context);
        } catch (CodeGenerationException e) {
            log.error("Code generation failed for {}", sourceName, e);
            return CompilationResult.failure(e.getMessage(), parsed.getDiagnostics());
        }

        return CompilationResult.builder()
                .success(true)
                .generatedSource(generated)
                .diagnostics(parsed.getDiagnostics())
                .structCount(context.getStructs().size())
                .pageCount(context.getPages().size())
                .handlerCount(context.getHandlers().size())
                .webMode(context.isWebMode())
                .build();
    }
}
