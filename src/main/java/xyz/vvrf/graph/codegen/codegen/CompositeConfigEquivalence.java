package xyz.vvrf.graph.codegen.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import xyz.vvrf.graph.codegen.core.CompositeConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 复合节点配置的等价关系：比较规范化后的 JSON 文本，而不是对象本身。
 * <p>
 * 规范化：对象键排序；子图节点按实例 ID 排序；数据边按（生产者, 消费者）排序；
 * 外部引脚按（方向, 序号）排序。执行边保持原顺序，因为它决定语句顺序。
 * 数值只比较文本形式，元数据中 Integer 与 Long 等装箱类型的差异不影响结果。
 *
 * @author ruifeng.wen
 */
public final class CompositeConfigEquivalence {

    private CompositeConfigEquivalence() {}

    public static boolean equivalent(ObjectMapper mapper, CompositeConfig a, CompositeConfig b) {
        return canonicalForm(mapper, a).equals(canonicalForm(mapper, b));
    }

    public static String canonicalForm(ObjectMapper mapper, CompositeConfig config) {
        JsonNode tree = canonicalize(mapper.valueToTree(config));
        JsonNode graph = tree.get("graph");
        if (graph instanceof ObjectNode) {
            sortArray((ObjectNode) graph, "nodes", n -> n.path("instanceId").asText());
            sortArray((ObjectNode) graph, "dataEdges",
                    n -> n.path("producerInstanceId").asText() + '\u0000' + n.path("consumerInstanceId").asText());
        }
        if (tree instanceof ObjectNode) {
            sortArray((ObjectNode) tree, "pins",
                    n -> n.path("direction").asText() + '\u0000' + String.format("%010d", n.path("index").asInt()));
        }
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("无法输出规范化 JSON", e);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            node.fields().forEachRemaining(e -> sorted.put(e.getKey(), canonicalize(e.getValue())));
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            node.forEach(item -> result.add(canonicalize(item)));
            return result;
        }
        return node;
    }

    private static void sortArray(ObjectNode parent, String field, Function<JsonNode, String> key) {
        JsonNode array = parent.get(field);
        if (array == null || !array.isArray()) {
            return;
        }
        List<JsonNode> items = new ArrayList<>();
        array.forEach(items::add);
        items.sort(Comparator.comparing(key));
        ArrayNode sorted = JsonNodeFactory.instance.arrayNode();
        items.forEach(sorted::add);
        parent.set(field, sorted);
    }
}
