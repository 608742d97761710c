package xyz.vvrf.graph.codegen.codegen;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.SignalBinding;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.util.GraphUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 一次生成的全部可变状态：调用名冲突表、签名缓存、依赖表以及本轮用到的调用名。
 * 不在并发的生成之间共享。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class GenerationSession {

    /** 生成代码在模块与方法中依赖的名称，节点调用名与局部变量都不能占用 */
    static final List<String> RUNTIME_NAMES = List.of("self", "game", "owner_entity", "GameRuntime",
            "composite_class", "sys", "Path", "PROJECT_ROOT", "ASSETS_ROOT",
            GenerationConfigResolver.BUILTINS_ALIAS);

    private final String graphName;
    private final GraphIR graph;
    private final GenerationConfig config;
    private final NodeLibrary library;
    private final SignatureInspector inspector;
    private final ArgumentBinder binder;
    private final IdentifierResolver callIdentifiers;
    /** 消费者 -> 生产者 */
    private final Map<String, List<String>> producers;
    private final Set<String> entryNodes;
    private final SortedSet<String> usedCallIdentifiers = new TreeSet<>();
    private final long libraryVersion;

    public GenerationSession(GraphIR graph, GenerationConfig config, NodeLibrary library,
                             long signatureCacheSize, Collection<String> reservedNames) {
        this.graph = Objects.requireNonNull(graph, "图不能为空");
        this.config = Objects.requireNonNull(config, "生成配置不能为空");
        this.library = Objects.requireNonNull(library, "节点库不能为空");
        this.graphName = graph.getGraphName();
        this.libraryVersion = library.getVersion();
        this.inspector = new SignatureInspector(library, graphName, signatureCacheSize);
        this.binder = new ArgumentBinder(graphName);
        Set<String> reserved = new LinkedHashSet<>(RUNTIME_NAMES);
        reserved.addAll(reservedNames);
        this.callIdentifiers = new IdentifierResolver("call:" + graphName, reserved);
        this.producers = GraphUtils.invert(GraphUtils.dataDependencies(graph));
        this.entryNodes = graph.getSignals().stream()
                .map(SignalBinding::getEntryInstanceId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * 是否为某个信号的入口节点。入口节点不生成调用，其输出作为事件处理器的参数。
     */
    public boolean isEntryNode(String instanceId) {
        return entryNodes.contains(instanceId);
    }

    /**
     * 预先按首次出现顺序占用调用名，不计入本轮实际使用的名称。
     */
    public String reserveCallIdentifier(NodeSignature signature) {
        return callIdentifiers.resolve(signature.getCallStem()).getIdentifier();
    }

    /**
     * 节点调用名：对别名或显示名做解析，同一词干文本总是得到同一个调用名。
     */
    public String callIdentifierFor(NodeSignature signature) {
        String identifier = callIdentifiers.resolve(signature.getCallStem()).getIdentifier();
        usedCallIdentifiers.add(identifier);
        return identifier;
    }

    /**
     * 新建方法作用域。局部变量不能遮蔽调用名与运行时名称。
     *
     * @param indentLevel 方法体的缩进层级
     * @param parameters  方法参数名，已占用
     */
    public MethodScope newMethodScope(int indentLevel, Collection<String> parameters) {
        Set<String> reserved = new LinkedHashSet<>(RUNTIME_NAMES);
        reserved.addAll(callIdentifiers.issuedIdentifiers());
        reserved.addAll(parameters);
        return new MethodScope(new SourceWriter(indentLevel), new IdentifierResolver("local:" + graphName, reserved));
    }

    public List<String> producersOf(String instanceId) {
        return producers.getOrDefault(instanceId, Collections.emptyList());
    }

    /**
     * 节点库在生成期间被修改时给出警告；结果可能不一致，但生成本身不受影响。
     */
    public void checkLibraryUnchanged() {
        long current = library.getVersion();
        if (current != libraryVersion) {
            log.warn("图 '{}': 生成期间节点库版本从 {} 变为 {}，生成结果可能不一致", graphName, libraryVersion, current);
        }
    }
}
