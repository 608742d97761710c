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
import java.util.List;
import java.util.Objects;

/**
 * 复合节点对外暴露的引脚，以及它映射到的内部端口。
 * 输入引脚可以映射到多个内部输入端口，输出引脚映射到恰好一个内部输出端口。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ExternalPin {

    public enum Direction {
        INPUT, OUTPUT
    }

    private final String name;
    private final Direction direction;
    private final int index;
    private final String pinType;
    private final String description;
    private final List<PortRef> mappedPorts;

    @JsonCreator
    public ExternalPin(@JsonProperty("name") String name,
                       @JsonProperty("direction") Direction direction,
                       @JsonProperty("index") int index,
                       @JsonProperty("pinType") String pinType,
                       @JsonProperty("description") String description,
                       @JsonProperty("mappedPorts") List<PortRef> mappedPorts) {
        this.name = Objects.requireNonNull(name, "引脚名不能为空");
        this.direction = Objects.requireNonNull(direction, "引脚方向不能为空");
        this.index = index;
        this.pinType = pinType == null ? "" : pinType;
        this.description = description == null ? "" : description;
        this.mappedPorts = mappedPorts == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(mappedPorts));
        if (direction == Direction.OUTPUT && this.mappedPorts.size() > 1) {
            throw new IllegalArgumentException("输出引脚 '" + name + "' 只能映射到一个内部端口");
        }
    }

    public static ExternalPin input(String name, int index, PortRef... targets) {
        return new ExternalPin(name, Direction.INPUT, index, null, null, List.of(targets));
    }

    public static ExternalPin output(String name, int index, PortRef source) {
        return new ExternalPin(name, Direction.OUTPUT, index, null, null,
                source == null ? Collections.emptyList() : List.of(source));
    }

    @JsonIgnore
    public boolean isInput() {
        return direction == Direction.INPUT;
    }
}
