package xyz.vvrf.graph.codegen.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 节点类型的描述信息，由节点库提供。
 * displayName 为任意用户文本，可能包含斜杠、冒号、括号等符号，不能直接作为标识符使用。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NodeDescriptor {
    private final String typeId;
    private final String displayName;
    private final String category;

    public NodeDescriptor(String typeId, String displayName, String category) {
        this.typeId = Objects.requireNonNull(typeId, "节点类型 ID 不能为空");
        this.displayName = displayName == null ? "" : displayName;
        this.category = category == null ? "" : category;
    }

    public static NodeDescriptor of(String typeId, String displayName, String category) {
        return new NodeDescriptor(typeId, displayName, category);
    }
}
