package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 复合节点配置：内部子图、对外引脚映射以及任意嵌套的元数据。
 * 必须能序列化为稳定的文本载荷并解析回等价的配置。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CompositeConfig {
    private final String compositeId;
    private final String nodeName;
    private final String description;
    private final GenerationConfig.Preset scope;
    private final String folderPath;
    private final GraphIR graph;
    private final List<ExternalPin> pins;
    /** 任意嵌套元数据，值限于 String / Number / Boolean / List / Map / null */
    private final Map<String, Object> metadata;

    @JsonCreator
    public CompositeConfig(@JsonProperty("compositeId") String compositeId,
                           @JsonProperty("nodeName") String nodeName,
                           @JsonProperty("description") String description,
                           @JsonProperty("scope") GenerationConfig.Preset scope,
                           @JsonProperty("folderPath") String folderPath,
                           @JsonProperty("graph") GraphIR graph,
                           @JsonProperty("pins") List<ExternalPin> pins,
                           @JsonProperty("metadata") Map<String, Object> metadata) {
        this.compositeId = Objects.requireNonNull(compositeId, "复合节点 ID 不能为空");
        this.nodeName = Objects.requireNonNull(nodeName, "复合节点名称不能为空");
        this.description = description == null ? "" : description;
        this.scope = scope == null ? GenerationConfig.Preset.SERVER : scope;
        this.folderPath = folderPath == null ? "" : folderPath;
        this.graph = Objects.requireNonNull(graph, "复合节点子图不能为空");
        this.pins = pins == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(pins));
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @JsonIgnore
    public List<ExternalPin> getInputPins() {
        return pinsOf(ExternalPin.Direction.INPUT);
    }

    @JsonIgnore
    public List<ExternalPin> getOutputPins() {
        return pinsOf(ExternalPin.Direction.OUTPUT);
    }

    private List<ExternalPin> pinsOf(ExternalPin.Direction direction) {
        return pins.stream()
                .filter(p -> p.getDirection() == direction)
                .sorted(Comparator.comparingInt(ExternalPin::getIndex))
                .collect(Collectors.toList());
    }
}
