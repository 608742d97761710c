package xyz.vvrf.graph.codegen.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.ExternalPin;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.PortRef;

import java.util.*;

/**
 * 构建复合节点配置，校验引脚名唯一且映射的内部端口所在节点存在。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CompositeConfigBuilder {

    private final String compositeId;
    private final String nodeName;
    private String description = "";
    private GenerationConfig.Preset scope = GenerationConfig.Preset.SERVER;
    private String folderPath = "";
    private GraphIR graph;
    private final List<ExternalPin> pins = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private int nextInputIndex;
    private int nextOutputIndex;

    public CompositeConfigBuilder(String compositeId, String nodeName) {
        this.compositeId = Objects.requireNonNull(compositeId, "复合节点 ID 不能为空");
        this.nodeName = Objects.requireNonNull(nodeName, "复合节点名称不能为空");
    }

    public CompositeConfigBuilder description(String description) {
        this.description = description;
        return this;
    }

    public CompositeConfigBuilder scope(GenerationConfig.Preset scope) {
        this.scope = Objects.requireNonNull(scope, "作用域不能为空");
        return this;
    }

    public CompositeConfigBuilder folderPath(String folderPath) {
        this.folderPath = folderPath;
        return this;
    }

    public CompositeConfigBuilder graph(GraphIR graph) {
        this.graph = Objects.requireNonNull(graph, "子图不能为空");
        return this;
    }

    public CompositeConfigBuilder inputPin(String name, String pinType, String description, PortRef... targets) {
        pins.add(new ExternalPin(name, ExternalPin.Direction.INPUT, nextInputIndex++, pinType, description, Arrays.asList(targets)));
        return this;
    }

    public CompositeConfigBuilder inputPin(String name, PortRef... targets) {
        return inputPin(name, null, null, targets);
    }

    public CompositeConfigBuilder outputPin(String name, String pinType, String description, PortRef source) {
        pins.add(new ExternalPin(name, ExternalPin.Direction.OUTPUT, nextOutputIndex++, pinType, description,
                source == null ? Collections.emptyList() : List.of(source)));
        return this;
    }

    public CompositeConfigBuilder outputPin(String name, PortRef source) {
        return outputPin(name, null, null, source);
    }

    public CompositeConfigBuilder metadata(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "元数据键不能为空"), value);
        return this;
    }

    public CompositeConfig build() {
        if (graph == null) {
            throw new IllegalStateException(String.format("复合节点 '%s' 未设置子图。", nodeName));
        }
        Set<String> inputNames = new HashSet<>();
        Set<String> outputNames = new HashSet<>();
        for (ExternalPin pin : pins) {
            Set<String> names = pin.isInput() ? inputNames : outputNames;
            if (!names.add(pin.getName())) {
                throw new IllegalArgumentException(String.format("复合节点 '%s': %s引脚 '%s' 重复。",
                        nodeName, pin.isInput() ? "输入" : "输出", pin.getName()));
            }
            for (PortRef ref : pin.getMappedPorts()) {
                if (!graph.findNode(ref.getInstanceId()).isPresent()) {
                    throw new IllegalArgumentException(String.format("复合节点 '%s': 引脚 '%s' 映射到不存在的节点 '%s'。",
                            nodeName, pin.getName(), ref.getInstanceId()));
                }
            }
        }
        CompositeConfig config = new CompositeConfig(compositeId, nodeName, description, scope, folderPath,
                graph, pins, metadata);
        log.info("复合节点 '{}' 构建完成: {} 个输入引脚, {} 个输出引脚", nodeName, inputNames.size(), outputNames.size());
        return config;
    }
}
