package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 图中一个节点类型的放置实例，带有自己的端口绑定（端口名 -> 绑定，保持声明顺序）。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NodeInstance {
    private final String instanceId;
    private final String typeId;
    private final Map<String, PinBinding> bindings;

    @JsonCreator
    public NodeInstance(@JsonProperty("instanceId") String instanceId,
                        @JsonProperty("typeId") String typeId,
                        @JsonProperty("bindings") Map<String, PinBinding> bindings) {
        this.instanceId = Objects.requireNonNull(instanceId, "节点实例 ID 不能为空");
        this.typeId = Objects.requireNonNull(typeId, "节点类型 ID 不能为空");
        this.bindings = bindings == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /**
     * 获取端口绑定，端口不存在时返回 UNBOUND。
     */
    public PinBinding binding(String pinName) {
        return bindings.getOrDefault(pinName, PinBinding.unbound());
    }
}
