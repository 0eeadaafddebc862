package com.zelang.compiler.codegen.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.model.Declaration;
import com.zelang.compiler.model.DeclarationVisitor;
import com.zelang.compiler.model.FunctionDecl;
import com.zelang.compiler.model.HandlerDecl;
import com.zelang.compiler.model.MainDecl;
import com.zelang.compiler.model.PageDecl;
import com.zelang.compiler.model.Program;
import com.zelang.compiler.model.StructDecl;

/**
 * Sorts top-level declarations into a {@link GenerationContext}.
 */
public class ProgramClassifier implements DeclarationVisitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(ProgramClassifier.class);

    private final GenerationContext.GenerationContextBuilder context;
    private int functionCount;
    private boolean hasMain;

    private ProgramClassifier(GeneratorConfig config) {
        this.context = GenerationContext.builder().config(config);
    }

    public static GenerationContext classify(Program program, GeneratorConfig config) {
        ProgramClassifier classifier = new ProgramClassifier(config);
        for (Declaration declaration : program.getDeclarations()) {
            declaration.accept(classifier);
        }
        GenerationContext result = classifier.context
                .functionCount(classifier.functionCount)
                .hasMain(classifier.hasMain)
                .build();
        log.debug("Classified program: {} struct(s), {} page(s), {} handler(s), web mode {}",
                result.getStructs().size(), result.getPages().size(),
                result.getHandlers().size(), result.isWebMode());
        if (result.getFunctionCount() > 0 || result.isHasMain()) {
            log.info("Skipping {} function(s){}; their bodies are not translated",
                    result.getFunctionCount(), result.isHasMain() ? " and the declared main" : "");
        }
        return result;
    }

    @Override
    public Void visitStruct(StructDecl struct) {
        context.struct(struct);
        return null;
    }

    @Override
    public Void visitPage(PageDecl page) {
        context.page(page);
        return null;
    }

    @Override
    public Void visitHandler(HandlerDecl handler) {
        context.handler(handler);
        return null;
    }

    @Override
    public Void visitFunction(FunctionDecl function) {
        // function bodies are not translated
        functionCount++;
        return null;
    }

    @Override
    public Void visitMain(MainDecl main) {
        // the generated entry point replaces any user main
        hasMain = true;
        return null;
    }
}
