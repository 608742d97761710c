package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 节点图的中间表示：节点实例（保持声明顺序）、执行边、数据边与信号绑定。
 * 不可变，由上游图模型构造后按值传入生成流程，生成过程不会修改它。
 * 结构合法性（ID 唯一、边引用存在）由 {@link xyz.vvrf.graph.codegen.builder.GraphIrBuilder} 保证。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class GraphIR {
    private final String graphId;
    private final String graphName;
    private final String description;
    private final List<NodeInstance> nodes;
    private final List<ExecutionEdge> executionEdges;
    private final List<DataEdge> dataEdges;
    private final List<SignalBinding> signals;

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final transient Map<String, NodeInstance> nodeIndex;

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final transient Map<String, List<String>> successorIndex;

    @JsonCreator
    public GraphIR(@JsonProperty("graphId") String graphId,
                   @JsonProperty("graphName") String graphName,
                   @JsonProperty("description") String description,
                   @JsonProperty("nodes") List<NodeInstance> nodes,
                   @JsonProperty("executionEdges") List<ExecutionEdge> executionEdges,
                   @JsonProperty("dataEdges") List<DataEdge> dataEdges,
                   @JsonProperty("signals") List<SignalBinding> signals) {
        this.graphId = graphId == null ? "" : graphId;
        this.graphName = graphName == null ? "" : graphName;
        this.description = description == null ? "" : description;
        this.nodes = copy(nodes);
        this.executionEdges = copy(executionEdges);
        this.dataEdges = copy(dataEdges);
        this.signals = copy(signals);

        Map<String, NodeInstance> index = new LinkedHashMap<>();
        for (NodeInstance node : this.nodes) {
            if (index.put(node.getInstanceId(), node) != null) {
                throw new IllegalArgumentException(String.format("图 '%s': 节点实例 ID '%s' 重复。",
                        this.graphName, node.getInstanceId()));
            }
        }
        this.nodeIndex = Collections.unmodifiableMap(index);

        Map<String, List<String>> successors = new HashMap<>();
        for (ExecutionEdge edge : this.executionEdges) {
            successors.computeIfAbsent(edge.getFromInstanceId(), k -> new ArrayList<>()).add(edge.getToInstanceId());
        }
        successors.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.successorIndex = successors;
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(source));
    }

    public Optional<NodeInstance> findNode(String instanceId) {
        return Optional.ofNullable(nodeIndex.get(instanceId));
    }

    /**
     * 按声明顺序返回某节点的执行出边终点。
     */
    public List<String> executionSuccessors(String instanceId) {
        return successorIndex.getOrDefault(instanceId, Collections.emptyList());
    }

    @Override
    public String toString() {
        return String.format("GraphIR[id=%s, name=%s, nodes=%d, execEdges=%d, dataEdges=%d, signals=%d]",
                graphId, graphName, nodes.size(), executionEdges.size(), dataEdges.size(), signals.size());
    }
}
