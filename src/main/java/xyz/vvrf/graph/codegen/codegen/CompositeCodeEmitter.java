package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.*;
import xyz.vvrf.graph.codegen.core.exception.CompositePayloadSerializationException;
import xyz.vvrf.graph.codegen.core.exception.UnboundRequiredPinException;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.*;

/**
 * 把复合节点生成为可导入、可像普通节点一样实例化的类声明。
 * <p>
 * 完整配置以不透明载荷的形式放在多行字符串常量 {@code COMPOSITE_CONFIG} 中，从不写成结构化字面量；
 * 生成后立即从源码中重新解析载荷，与原配置不等价时失败。
 * {@code execute} 方法以外部输入引脚为参数，先按执行流顺序、再按声明顺序发出子图中的全部节点，
 * 最后返回外部输出引脚对应的变量。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CompositeCodeEmitter extends AbstractScriptEmitter {

    public static final String COMPOSITE_DECORATOR = "@composite_class";
    private static final String COMPOSITE_DECORATOR_NAME = "composite_class";

    private final CompositePayloadCodec codec;

    public CompositeCodeEmitter(NodeLibrary library, GenerationConfigResolver configResolver,
                                ExpressionEmitter expressions, CompositePayloadCodec codec, long signatureCacheSize) {
        super(library, configResolver, expressions, signatureCacheSize);
        this.codec = Objects.requireNonNull(codec, "载荷编解码器不能为空");
    }

    /**
     * 生成复合节点源码。
     *
     * @throws xyz.vvrf.graph.codegen.core.exception.CodegenException 子图无法生成或载荷无法往返时
     */
    public String emitComposite(CompositeConfig composite, GenerationConfig config) {
        Objects.requireNonNull(composite, "复合节点配置不能为空");
        Objects.requireNonNull(config, "生成配置不能为空");
        GraphIR graph = composite.getGraph();
        checkGraph(graph);
        List<String> payload = codec.encodeLines(composite);

        GenerationSession session = openSession(graph, config);
        for (NodeInstance node : graph.getNodes()) {
            session.reserveCallIdentifier(session.getInspector().inspect(node.getTypeId()));
        }

        MethodScope scope = session.newMethodScope(2, Collections.emptyList());
        List<String> parameters = new ArrayList<>();
        for (ExternalPin pin : composite.getInputPins()) {
            String name = scope.freshVariable(pin.getName());
            for (PortRef port : pin.getMappedPorts()) {
                scope.overrideInput(port, pin.getName(), name);
            }
            parameters.add(name);
        }

        emitBody(session, scope);
        List<String> returned = returnedNames(composite, scope);
        if (!returned.isEmpty()) {
            scope.writer().line("return " + String.join(", ", returned));
        }
        scope.writer().passIfEmptySince(0);
        session.checkLibraryUnchanged();

        SourceWriter classBody = new SourceWriter(1);
        writeClassDocstring(classBody, composite);
        classBody.line(CompositePayloadCodec.PAYLOAD_CONSTANT + " = \"\"\"");
        payload.forEach(classBody::line);
        classBody.line("\"\"\"");
        classBody.blank();
        writeInit(classBody);
        classBody.blank();
        classBody.line(methodSignature("execute", parameters));
        classBody.indent();
        writeExecuteDocstring(classBody, composite);
        classBody.dedent();
        classBody.append(scope.writer());

        Set<String> imported = new TreeSet<>(session.getUsedCallIdentifiers());
        imported.add(COMPOSITE_DECORATOR_NAME);
        GenerationPreamble preamble = configResolver.resolve(config, imported);

        SourceWriter out = new SourceWriter();
        Map<String, String> header = new LinkedHashMap<>();
        header.put("composite_id", composite.getCompositeId());
        header.put("node_name", composite.getNodeName());
        header.put("node_description", composite.getDescription());
        header.put("scope", composite.getScope().label());
        header.put("folder_path", composite.getFolderPath());
        writeHeader(out, header);
        writeImports(out, preamble);
        preamble.validationDecorator().ifPresent(out::line);
        out.line(COMPOSITE_DECORATOR);
        out.line("class " + IdentifierResolver.sanitizeClassName(composite.getNodeName()) + ":");
        out.append(classBody);

        String source = out.toString();
        verifyRoundTrip(composite, source);
        log.info("复合节点 '{}': 代码生成完成 (节点: {}, 输入: {}, 输出: {}, 载荷行数: {})", composite.getNodeName(),
                graph.getNodes().size(), parameters.size(), returned.size(), payload.size());
        return source;
    }

    private void emitBody(GenerationSession session, MethodScope scope) {
        GraphIR graph = session.getGraph();
        NodeStatementEmitter statements = new NodeStatementEmitter(session, expressions);
        Set<String> hasIncomingFlow = new HashSet<>();
        graph.getExecutionEdges().forEach(e -> hasIncomingFlow.add(e.getToInstanceId()));

        Set<String> visited = new HashSet<>();
        for (NodeInstance node : graph.getNodes()) {
            if (!hasIncomingFlow.contains(node.getInstanceId())) {
                walk(node.getInstanceId(), session, statements, scope, visited);
            }
        }
        // 只存在于执行环中的节点没有入口，按声明顺序补齐
        for (NodeInstance node : graph.getNodes()) {
            walk(node.getInstanceId(), session, statements, scope, visited);
        }
    }

    private static List<String> returnedNames(CompositeConfig composite, MethodScope scope) {
        List<String> names = new ArrayList<>();
        for (ExternalPin pin : composite.getOutputPins()) {
            if (pin.getMappedPorts().isEmpty()) {
                throw new UnboundRequiredPinException(composite.getNodeName(), composite.getCompositeId(), pin.getName());
            }
            PortRef source = pin.getMappedPorts().get(0);
            names.add(scope.lookupOutput(source).orElseThrow(() -> new IllegalStateException(String.format(
                    "复合节点 '%s': 输出引脚 '%s' 映射的端口 %s 没有求值结果（节点未声明该输出端口）。",
                    composite.getNodeName(), pin.getName(), source))));
        }
        return names;
    }

    private void verifyRoundTrip(CompositeConfig composite, String source) {
        CompositeConfig parsed = codec.decode(source);
        if (!codec.equivalent(composite, parsed)) {
            throw new CompositePayloadSerializationException(composite.getNodeName(), "载荷解析后的配置与原配置不等价");
        }
        log.debug("复合节点 '{}': 载荷往返校验通过", composite.getNodeName());
    }

    private static void writeClassDocstring(SourceWriter classBody, CompositeConfig composite) {
        classBody.line("\"\"\"复合节点：" + PythonSyntax.docstringLine(composite.getNodeName()));
        if (!composite.getDescription().isEmpty()) {
            classBody.blank();
            classBody.line(PythonSyntax.docstringLine(composite.getDescription()));
        }
        classBody.line("\"\"\"");
        classBody.blank();
    }

    private static void writeExecuteDocstring(SourceWriter body, CompositeConfig composite) {
        body.line("\"\"\"执行复合节点");
        writePinSection(body, "输入引脚:", composite.getInputPins());
        writePinSection(body, "输出引脚:", composite.getOutputPins());
        body.line("\"\"\"");
    }

    private static void writePinSection(SourceWriter body, String title, List<ExternalPin> pins) {
        if (pins.isEmpty()) {
            return;
        }
        body.blank();
        body.line(title);
        for (ExternalPin pin : pins) {
            StringBuilder sb = new StringBuilder("    ").append(pin.getName());
            if (!pin.getPinType().isEmpty()) {
                sb.append(" (").append(pin.getPinType()).append(')');
            }
            if (!pin.getDescription().isEmpty()) {
                sb.append(": ").append(pin.getDescription());
            }
            body.line(PythonSyntax.docstringLine(sb.toString()));
        }
    }
}
