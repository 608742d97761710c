package xyz.vvrf.graph.codegen.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.*;
import xyz.vvrf.graph.codegen.util.GraphUtils;

import java.util.*;

/**
 * 用于以编程方式构建不可变的 GraphIR。
 * 只检查结构（ID 唯一、引用存在）；节点类型是否注册在生成时由签名检查负责。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GraphIrBuilder {

    private String graphId = "";
    private String graphName;
    private String description = "";

    private final Map<String, String> nodeTypes = new LinkedHashMap<>();
    private final Map<String, Map<String, PinBinding>> bindings = new LinkedHashMap<>();
    private final List<ExecutionEdge> executionEdges = new ArrayList<>();
    private final Set<DataEdge> dataEdges = new LinkedHashSet<>();
    private final List<SignalBinding> signals = new ArrayList<>();

    public GraphIrBuilder(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
    }

    public GraphIrBuilder graphId(String graphId) {
        this.graphId = Objects.requireNonNull(graphId, "图 ID 不能为空");
        return this;
    }

    public GraphIrBuilder name(String name) {
        this.graphName = Objects.requireNonNull(name, "图名称不能为空");
        return this;
    }

    public GraphIrBuilder description(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public GraphIrBuilder addNode(String instanceId, String typeId) {
        Objects.requireNonNull(instanceId, "节点实例 ID 不能为空");
        Objects.requireNonNull(typeId, "节点类型 ID 不能为空");
        if (nodeTypes.containsKey(instanceId)) {
            throw new IllegalArgumentException(String.format("节点实例 ID '%s' 在图 '%s' 中已存在。", instanceId, graphName));
        }
        nodeTypes.put(instanceId, typeId);
        bindings.put(instanceId, new LinkedHashMap<>());
        log.debug("图 '{}': 添加了节点 '{}' (类型: {})", graphName, instanceId, typeId);
        return this;
    }

    public GraphIrBuilder bind(String instanceId, String pinName, PinBinding binding) {
        Objects.requireNonNull(pinName, "端口名不能为空");
        Objects.requireNonNull(binding, "端口绑定不能为空");
        bindingsOf(instanceId).put(pinName, binding);
        return this;
    }

    public GraphIrBuilder literal(String instanceId, String pinName, LiteralValue value) {
        return bind(instanceId, pinName, PinBinding.literal(value));
    }

    public GraphIrBuilder literal(String instanceId, String pinName, String text) {
        return literal(instanceId, pinName, LiteralValue.ofString(text));
    }

    public GraphIrBuilder literal(String instanceId, String pinName, long value) {
        return literal(instanceId, pinName, LiteralValue.ofInteger(value));
    }

    public GraphIrBuilder template(String instanceId, String pinName, TemplatePart... parts) {
        return bind(instanceId, pinName, PinBinding.template(Arrays.asList(parts)));
    }

    /**
     * 连线：把上游输出端口绑定到下游输入端口，同时登记一条数据边。
     */
    public GraphIrBuilder connect(String producerId, String outputPin, String consumerId, String inputPin) {
        bindingsOf(producerId);
        bind(consumerId, inputPin, PinBinding.output(producerId, outputPin));
        dataEdges.add(new DataEdge(producerId, consumerId));
        log.debug("图 '{}': 添加了数据连线 {}[{}] -> {}[{}]", graphName, producerId, outputPin, consumerId, inputPin);
        return this;
    }

    public GraphIrBuilder dataEdge(String producerId, String consumerId) {
        bindingsOf(producerId);
        bindingsOf(consumerId);
        dataEdges.add(new DataEdge(producerId, consumerId));
        return this;
    }

    public GraphIrBuilder then(String fromId, String toId) {
        bindingsOf(fromId);
        bindingsOf(toId);
        executionEdges.add(new ExecutionEdge(fromId, toId));
        log.debug("图 '{}': 添加了执行边 {} => {}", graphName, fromId, toId);
        return this;
    }

    /**
     * 依次用执行边串联多个节点。
     */
    public GraphIrBuilder chain(String... instanceIds) {
        for (int i = 1; i < instanceIds.length; i++) {
            then(instanceIds[i - 1], instanceIds[i]);
        }
        return this;
    }

    public GraphIrBuilder signal(String signalName, String entryInstanceId) {
        bindingsOf(entryInstanceId);
        signals.add(new SignalBinding(signalName, entryInstanceId));
        return this;
    }

    private Map<String, PinBinding> bindingsOf(String instanceId) {
        Objects.requireNonNull(instanceId, "节点实例 ID 不能为空");
        Map<String, PinBinding> nodeBindings = bindings.get(instanceId);
        if (nodeBindings == null) {
            throw new IllegalArgumentException(String.format("在图 '%s' 中找不到节点实例 '%s'。", graphName, instanceId));
        }
        return nodeBindings;
    }

    /**
     * 构建不可变 GraphIR 并校验结构。
     *
     * @throws IllegalStateException 结构不合法时
     */
    public GraphIR build() {
        List<NodeInstance> nodes = new ArrayList<>();
        nodeTypes.forEach((id, type) -> nodes.add(new NodeInstance(id, type, bindings.get(id))));
        GraphIR graph = new GraphIR(graphId, graphName, description, nodes, executionEdges, new ArrayList<>(dataEdges), signals);
        GraphUtils.validateGraphStructure(graph);
        log.info("图 '{}' 构建完成: {}", graphName, graph);
        return graph;
    }
}
