package xyz.vvrf.graph.codegen.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.DataEdge;
import xyz.vvrf.graph.codegen.core.ExecutionEdge;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.NodeInstance;
import xyz.vvrf.graph.codegen.core.PinBinding;
import xyz.vvrf.graph.codegen.core.PortRef;
import xyz.vvrf.graph.codegen.core.SignalBinding;
import xyz.vvrf.graph.codegen.core.exception.CyclicDependencyException;

import java.util.*;

/**
 * 提供图结构验证、数据依赖收集和拓扑排序的工具方法。
 * 基于 GraphIR 数据结构操作。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 验证图结构的引用完整性：边、绑定和信号引用的节点都必须存在。
     *
     * @param graph 图 IR
     * @throws IllegalStateException 如果验证失败
     */
    public static void validateGraphStructure(GraphIR graph) throws IllegalStateException {
        String graphName = graph.getGraphName();
        log.debug("图 '{}': 开始结构验证...", graphName);

        for (ExecutionEdge edge : graph.getExecutionEdges()) {
            requireNode(graph, edge.getFromInstanceId(), "执行边起点");
            requireNode(graph, edge.getToInstanceId(), "执行边终点");
        }
        for (DataEdge edge : graph.getDataEdges()) {
            requireNode(graph, edge.getProducerInstanceId(), "数据边生产者");
            requireNode(graph, edge.getConsumerInstanceId(), "数据边消费者");
        }
        for (NodeInstance node : graph.getNodes()) {
            for (Map.Entry<String, PinBinding> binding : node.getBindings().entrySet()) {
                for (PortRef ref : binding.getValue().referencedOutputs()) {
                    requireNode(graph, ref.getInstanceId(),
                            String.format("节点 '%s' 端口 '%s' 的绑定", node.getInstanceId(), binding.getKey()));
                }
            }
        }
        Set<String> signalNames = new HashSet<>();
        for (SignalBinding signal : graph.getSignals()) {
            requireNode(graph, signal.getEntryInstanceId(), "信号 '" + signal.getSignalName() + "' 的入口");
            if (!signalNames.add(signal.getSignalName())) {
                throw new IllegalStateException(String.format("图 '%s': 信号 '%s' 重复绑定。",
                        graphName, signal.getSignalName()));
            }
        }
        log.debug("图 '{}': 结构验证通过。", graphName);
    }

    private static void requireNode(GraphIR graph, String instanceId, String role) {
        if (!graph.findNode(instanceId).isPresent()) {
            throw new IllegalStateException(String.format("图 '%s': %s引用了不存在的节点 '%s'。",
                    graph.getGraphName(), role, instanceId));
        }
    }

    /**
     * 收集完整的数据依赖：显式数据边加上端口绑定中对其他节点输出的引用。
     *
     * @return 生产者 -> 消费者列表（按节点声明顺序，去重）
     */
    public static Map<String, List<String>> dataDependencies(GraphIR graph) {
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        for (NodeInstance node : graph.getNodes()) {
            adj.put(node.getInstanceId(), new LinkedHashSet<>());
        }
        for (DataEdge edge : graph.getDataEdges()) {
            adj.computeIfAbsent(edge.getProducerInstanceId(), k -> new LinkedHashSet<>())
                    .add(edge.getConsumerInstanceId());
        }
        for (NodeInstance node : graph.getNodes()) {
            for (PinBinding binding : node.getBindings().values()) {
                for (PortRef ref : binding.referencedOutputs()) {
                    adj.computeIfAbsent(ref.getInstanceId(), k -> new LinkedHashSet<>())
                            .add(node.getInstanceId());
                }
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        adj.forEach((k, v) -> result.put(k, new ArrayList<>(v)));
        return result;
    }

    /**
     * 反转依赖表：消费者 -> 生产者列表。
     */
    public static Map<String, List<String>> invert(Map<String, List<String>> adj) {
        Map<String, List<String>> reversed = new LinkedHashMap<>();
        for (String node : adj.keySet()) {
            reversed.put(node, new ArrayList<>());
        }
        adj.forEach((producer, consumers) -> {
            for (String consumer : consumers) {
                List<String> producers = reversed.computeIfAbsent(consumer, k -> new ArrayList<>());
                if (!producers.contains(producer)) {
                    producers.add(producer);
                }
            }
        });
        return reversed;
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。入度相同的节点按邻接表的键顺序（即节点声明顺序）出队，结果确定。
     *
     * @param adj       生产者 -> 消费者列表，键集合即全部节点
     * @param graphName 图名称
     * @return 按拓扑顺序排列的节点 ID 列表
     * @throws CyclicDependencyException 如果存在环
     */
    public static List<String> topologicalSort(Map<String, List<String>> adj, String graphName) {
        log.debug("图 '{}': 开始拓扑排序...", graphName);
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String node : adj.keySet()) {
            inDegree.put(node, 0);
        }
        for (List<String> neighbors : adj.values()) {
            for (String neighbor : neighbors) {
                inDegree.merge(neighbor, 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<String> sortedOrder = new ArrayList<>();
        while (!queue.isEmpty()) {
            String u = queue.poll();
            sortedOrder.add(u);
            for (String v : adj.getOrDefault(u, Collections.emptyList())) {
                if (inDegree.merge(v, -1, Integer::sum) == 0) {
                    queue.offer(v);
                }
            }
        }

        if (sortedOrder.size() != inDegree.size()) {
            Set<String> remaining = new LinkedHashSet<>(inDegree.keySet());
            sortedOrder.forEach(remaining::remove);
            throw new CyclicDependencyException(graphName, remaining);
        }

        log.debug("图 '{}': 拓扑排序完成，共 {} 个节点。", graphName, sortedOrder.size());
        return Collections.unmodifiableList(sortedOrder);
    }
}
