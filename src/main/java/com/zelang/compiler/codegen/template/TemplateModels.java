package com.zelang.compiler.codegen.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import com.zelang.compiler.codegen.context.GenerationContext;
import com.zelang.compiler.codegen.context.GeneratorConfig;
import com.zelang.compiler.codegen.mapper.TypeMapper;
import com.zelang.compiler.codegen.mapper.ValueKind;
import com.zelang.compiler.codegen.model.DemoModel;
import com.zelang.compiler.codegen.model.FieldModel;
import com.zelang.compiler.codegen.model.HandlerStubModel;
import com.zelang.compiler.codegen.model.PageModel;
import com.zelang.compiler.codegen.model.StructModel;
import com.zelang.compiler.codegen.model.WebModel;
import com.zelang.compiler.codegen.util.DecoratorRules;
import com.zelang.compiler.codegen.util.NamingUtil;
import com.zelang.compiler.model.FieldDecl;
import com.zelang.compiler.model.HandlerDecl;
import com.zelang.compiler.model.PageDecl;
import com.zelang.compiler.model.StructDecl;

/**
 * Builds template models from a {@link GenerationContext}. Every list keeps
 * field declaration order.
 */
public class TemplateModels {

    private static final String[][] DEMO_SAMPLES = {
        {"John Doe", "Class A"},
        {"Jane Smith", "Class B"},
        {"Bob Johnson", "Class A"}
    };
    private static final String DEMO_FALLBACK = "Sample";

    private final GenerationContext context;
    private final List<StructModel> structs;

    public TemplateModels(GenerationContext context) {
        this.context = context;
        this.structs = context.getStructs().stream()
                .map(TemplateModels::toStructModel)
                .toList();
    }

    public List<StructModel> getStructs() {
        return structs;
    }

    public Optional<StructModel> getPrimaryStruct() {
        return structs.stream().findFirst();
    }

    public static StructModel toStructModel(StructDecl struct) {
        StructModel.StructModelBuilder model = StructModel.builder()
                .name(struct.getName())
                .tableName(NamingUtil.tableName(struct))
                .variableName(struct.getName().toLowerCase(Locale.ROOT))
                .createPath(NamingUtil.createPath(struct))
                .deletePath(NamingUtil.deletePath(struct));

        String identifier = DecoratorRules.identifierColumn(struct);
        model.identifier(identifier);

        int columnIndex = 0;
        List<String> columnNames = new ArrayList<>();
        FieldModel labelColumn = null;
        FieldModel identifierField = null;

        for (FieldDecl field : struct.getFields()) {
            FieldModel fieldModel = toFieldModel(field, field.isArray() ? -1 : columnIndex);
            model.member(fieldModel);

            if (field.isArray()) {
                continue;
            }
            columnIndex++;
            columnNames.add(field.getName());
            model.column(fieldModel);

            if (fieldModel.isCreateParam()) {
                model.createParam(fieldModel);
            } else {
                model.derivedField(fieldModel);
            }
            if (fieldModel.isFormField()) {
                model.formField(fieldModel);
            }
            if (labelColumn == null && ValueKind.TEXT.name().equals(fieldModel.getKind())) {
                labelColumn = fieldModel;
            }
            if (identifierField == null && field.getName().equals(identifier)) {
                identifierField = fieldModel;
            }
        }

        return model
                .selectList(columnNames.isEmpty() ? "*" : String.join(", ", columnNames))
                .labelColumn(labelColumn)
                .identifierField(identifierField)
                .build();
    }

    static FieldModel toFieldModel(FieldDecl field, int columnIndex) {
        String type = field.getType();
        return FieldModel.builder()
                .name(field.getName())
                .nativeType(TypeMapper.toNativeType(type))
                .sqlType(TypeMapper.toSqlType(type))
                .constraints(DecoratorRules.constraintSuffix(field))
                .kind(TypeMapper.toValueKind(type).name())
                .title(NamingUtil.capitalize(field.getName()))
                .columnIndex(columnIndex)
                .array(field.isArray())
                .createParam(DecoratorRules.isCreateParam(field))
                .generatedIdentifier(DecoratorRules.isGeneratedIdentifier(field))
                .formField(DecoratorRules.isFormField(field))
                .required(DecoratorRules.isRequired(field))
                .inputKind(DecoratorRules.inputKind(field).name().toLowerCase(Locale.ROOT))
                .build();
    }

    /**
     * Page model for the first page, bound to the first struct. Empty unless
     * both exist.
     */
    public Optional<PageModel> pageModel() {
        Optional<PageDecl> page = context.getPrimaryPage();
        Optional<StructModel> struct = getPrimaryStruct();
        if (page.isEmpty() || struct.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PageModel.builder()
                .title(page.get().getName())
                .renderFunction(NamingUtil.renderFunctionName(page.get()))
                .struct(struct.get())
                .htmlBufferSize(context.getConfig().getHtmlBufferSize())
                .build());
    }

    public WebModel webModel() {
        GeneratorConfig config = context.getConfig();
        return WebModel.builder()
                .structs(structs)
                .primaryStruct(getPrimaryStruct().orElse(null))
                .page(pageModel().orElse(null))
                .handlers(context.getHandlers().stream().map(TemplateModels::toHandlerStub).toList())
                .databasePath(config.getDatabasePath())
                .httpPort(config.getHttpPort())
                .maxFormPairs(config.getMaxFormPairs())
                .build();
    }

    public DemoModel demoModel() {
        DemoModel.DemoModelBuilder demo = DemoModel.builder()
                .structs(structs)
                .databasePath(context.getConfig().getDatabasePath());

        getPrimaryStruct().ifPresent(struct -> {
            demo.primaryStruct(struct);
            for (int i = 0; i < DEMO_SAMPLES.length; i++) {
                demo.record(new DemoModel.DemoRecord(
                        struct.getVariableName() + (i + 1),
                        demoArguments(struct, i)));
            }
        });
        return demo.build();
    }

    /**
     * Arguments for the i-th sample create: text parameters take the sample
     * value at their position among the parameters, others {@code (i+1)*10}.
     */
    static String demoArguments(StructModel struct, int record) {
        List<String> arguments = new ArrayList<>();
        List<FieldModel> params = struct.getCreateParams();
        for (int j = 0; j < params.size(); j++) {
            FieldModel param = params.get(j);
            ValueKind kind = ValueKind.valueOf(param.getKind());
            if (kind == ValueKind.TEXT) {
                String[] sample = DEMO_SAMPLES[record];
                arguments.add("\"" + (j < sample.length ? sample[j] : DEMO_FALLBACK) + "\"");
            } else if (kind == ValueKind.OPAQUE) {
                arguments.add("(" + param.getNativeType() + "){0}");
            } else {
                arguments.add(String.valueOf((record + 1) * 10));
            }
        }
        return String.join(", ", arguments);
    }

    static HandlerStubModel toHandlerStub(HandlerDecl handler) {
        String params = handler.getParameters().stream()
                .map(p -> p.getType() + " " + p.getName())
                .collect(Collectors.joining(", "));
        return new HandlerStubModel(handler.getName(), handler.getName() + "(" + params + ")");
    }
}
