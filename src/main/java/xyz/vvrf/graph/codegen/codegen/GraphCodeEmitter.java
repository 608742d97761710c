package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.NodeInstance;
import xyz.vvrf.graph.codegen.core.PortRef;
import xyz.vvrf.graph.codegen.core.SignalBinding;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.*;

/**
 * 把图 IR 生成为完整可运行的节点图脚本：头部文档、导入、可选校验装饰器、
 * 每个信号一个事件处理方法，以及统一的处理器注册方法。
 * <p>
 * 处理方法内按执行边的声明顺序深度优先遍历，每个节点之前先发出它尚未求值的数据依赖。
 * 信号入口节点本身不生成调用，它的输出端口成为处理方法的参数。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GraphCodeEmitter extends AbstractScriptEmitter {

    private static final List<String> CLASS_MEMBERS = List.of("__init__", "register_handlers");

    public GraphCodeEmitter(NodeLibrary library, GenerationConfigResolver configResolver,
                            ExpressionEmitter expressions, long signatureCacheSize) {
        super(library, configResolver, expressions, signatureCacheSize);
    }

    /**
     * 生成图脚本。
     *
     * @throws xyz.vvrf.graph.codegen.core.exception.CodegenException 节点类型未知、必需端口未绑定、
     *         变参端口名非法、数据依赖成环时
     */
    public String emitGraph(GraphIR graph, GenerationConfig config) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(config, "生成配置不能为空");
        checkGraph(graph);

        GenerationSession session = openSession(graph, config);
        for (NodeInstance node : graph.getNodes()) {
            NodeSignature signature = session.getInspector().inspect(node.getTypeId());
            if (!session.isEntryNode(node.getInstanceId())) {
                session.reserveCallIdentifier(signature);
            }
        }

        List<HandlerBinding> handlers = bindHandlers(graph);
        NodeStatementEmitter statements = new NodeStatementEmitter(session, expressions);
        Set<String> emitted = new HashSet<>();

        SourceWriter classBody = new SourceWriter(1);
        classBody.line("\"\"\"节点图类：" + PythonSyntax.docstringLine(graph.getGraphName()) + "\"\"\"");
        classBody.blank();
        writeInit(classBody);
        classBody.blank();
        for (HandlerBinding handler : handlers) {
            emitHandler(handler, session, statements, classBody, emitted);
            classBody.blank();
        }
        writeRegisterHandlers(classBody, handlers);

        warnUnreachable(graph, session, emitted);
        session.checkLibraryUnchanged();

        GenerationPreamble preamble = configResolver.resolve(config, session.getUsedCallIdentifiers());
        SourceWriter out = new SourceWriter();
        Map<String, String> header = new LinkedHashMap<>();
        header.put("graph_id", graph.getGraphId());
        header.put("graph_name", graph.getGraphName());
        header.put("graph_type", config.getPreset().label());
        header.put("description", graph.getDescription());
        writeHeader(out, header);
        writeImports(out, preamble);
        preamble.validationDecorator().ifPresent(out::line);
        out.line("class " + IdentifierResolver.sanitizeClassName(graph.getGraphName()) + ":");
        out.append(classBody);

        log.info("图 '{}': 代码生成完成 (节点: {}, 处理器: {}, 已发出调用: {})",
                graph.getGraphName(), graph.getNodes().size(), handlers.size(), emitted.size());
        return out.toString();
    }

    /**
     * 按声明顺序为每个信号确定处理方法名。
     */
    List<HandlerBinding> bindHandlers(GraphIR graph) {
        IdentifierResolver handlerNames = new IdentifierResolver("handler:" + graph.getGraphName(), CLASS_MEMBERS);
        List<HandlerBinding> handlers = new ArrayList<>();
        for (SignalBinding signal : graph.getSignals()) {
            handlers.add(new HandlerBinding(signal.getSignalName(), signal.getEntryInstanceId(),
                    handlerNames.resolve(signal.getSignalName())));
        }
        return handlers;
    }

    private void emitHandler(HandlerBinding handler, GenerationSession session, NodeStatementEmitter statements,
                             SourceWriter classBody, Set<String> emitted) {
        String entryId = handler.getEntryInstanceId();
        NodeInstance entry = session.getGraph().findNode(entryId).orElseThrow();
        NodeSignature entrySignature = session.getInspector().inspect(entry.getTypeId());

        MethodScope scope = session.newMethodScope(2, Collections.emptyList());
        List<String> parameters = new ArrayList<>();
        for (String pin : entrySignature.getOutputPins()) {
            String name = scope.freshVariable(pin);
            scope.bindOutput(PortRef.of(entryId, pin), name);
            parameters.add(name);
        }
        scope.markEmitted(entryId);

        classBody.line(methodSignature(handler.getMethodName(), parameters));
        classBody.indent();
        classBody.line("\"\"\"事件处理器：" + PythonSyntax.docstringLine(handler.getSignalName()) + "\"\"\"");
        classBody.dedent();

        Set<String> visited = new HashSet<>();
        visited.add(entryId);
        for (String next : session.getGraph().executionSuccessors(entryId)) {
            walk(next, session, statements, scope, visited);
        }
        scope.writer().passIfEmptySince(0);
        classBody.append(scope.writer());
        emitted.addAll(scope.emittedInstances());
        emitted.remove(entryId);
    }

    private static void writeRegisterHandlers(SourceWriter classBody, List<HandlerBinding> handlers) {
        classBody.line("def register_handlers(self):");
        classBody.indent();
        classBody.line("\"\"\"注册所有事件处理器\"\"\"");
        if (handlers.isEmpty()) {
            classBody.line("pass");
        }
        for (HandlerBinding handler : handlers) {
            classBody.line(handler.registrationStatement());
        }
        classBody.dedent();
    }

    private static void warnUnreachable(GraphIR graph, GenerationSession session, Set<String> emitted) {
        List<String> unreachable = new ArrayList<>();
        for (NodeInstance node : graph.getNodes()) {
            if (!emitted.contains(node.getInstanceId()) && !session.isEntryNode(node.getInstanceId())) {
                unreachable.add(node.getInstanceId());
            }
        }
        if (!unreachable.isEmpty()) {
            log.warn("图 '{}': {} 个节点不在任何信号的执行流中，未生成调用: {}",
                    graph.getGraphName(), unreachable.size(), unreachable);
        }
    }
}
