package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.util.GraphUtils;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 图脚本与复合节点脚本共用的骨架：结构检查、会话创建、头部文档与类构造方法。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class AbstractScriptEmitter {

    protected final NodeLibrary library;
    protected final GenerationConfigResolver configResolver;
    protected final ExpressionEmitter expressions;
    protected final long signatureCacheSize;

    protected AbstractScriptEmitter(NodeLibrary library, GenerationConfigResolver configResolver,
                                    ExpressionEmitter expressions, long signatureCacheSize) {
        this.library = Objects.requireNonNull(library, "节点库不能为空");
        this.configResolver = Objects.requireNonNull(configResolver, "配置解析器不能为空");
        this.expressions = Objects.requireNonNull(expressions, "表达式发射器不能为空");
        if (signatureCacheSize <= 0) {
            throw new IllegalArgumentException("签名缓存大小必须为正数");
        }
        this.signatureCacheSize = signatureCacheSize;
    }

    /**
     * 检查结构并确认数据依赖可以线性化。任何文本产生之前执行。
     */
    protected void checkGraph(GraphIR graph) {
        GraphUtils.validateGraphStructure(graph);
        GraphUtils.topologicalSort(GraphUtils.dataDependencies(graph), graph.getGraphName());
    }

    protected GenerationSession openSession(GraphIR graph, GenerationConfig config) {
        return new GenerationSession(graph, config, library, signatureCacheSize, configResolver.reservedNames(config));
    }

    protected static void writeHeader(SourceWriter out, Map<String, String> fields) {
        out.line("\"\"\"");
        fields.forEach((key, value) -> {
            if (value != null && !value.isEmpty()) {
                out.line(key + ": " + PythonSyntax.docstringLine(value));
            }
        });
        out.line("\"\"\"");
    }

    protected static void writeImports(SourceWriter out, GenerationPreamble preamble) {
        out.blank();
        preamble.getImportLines().forEach(out::line);
        out.blank();
        out.blank();
    }

    /**
     * 写入类级 {@code __init__}，保存运行时与挂载实体。
     */
    protected static void writeInit(SourceWriter classBody) {
        classBody.line("def __init__(self, game: GameRuntime, owner_entity):");
        classBody.indent();
        classBody.line("\"\"\"初始化");
        classBody.blank();
        classBody.line("Args:");
        classBody.line("    game: 游戏运行时");
        classBody.line("    owner_entity: 挂载的实体（自身实体）");
        classBody.line("\"\"\"");
        classBody.line("self.game = game");
        classBody.line("self.owner_entity = owner_entity");
        classBody.dedent();
    }

    /**
     * 沿执行边按声明顺序深度优先发出节点，已访问的节点跳过。使用显式栈，长执行链不会耗尽调用栈。
     */
    protected static void walk(String instanceId, GenerationSession session, NodeStatementEmitter statements,
                               MethodScope scope, Set<String> visited) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(instanceId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            statements.emit(current, scope);
            List<String> successors = session.getGraph().executionSuccessors(current);
            for (int i = successors.size() - 1; i >= 0; i--) {
                stack.push(successors.get(i));
            }
        }
    }

    protected static String methodSignature(String name, Collection<String> parameters) {
        StringBuilder sb = new StringBuilder("def ").append(name).append("(self");
        parameters.forEach(p -> sb.append(", ").append(p));
        return sb.append("):").toString();
    }
}
