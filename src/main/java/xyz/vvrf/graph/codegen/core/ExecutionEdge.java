package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 执行边：决定生成脚本中的语句顺序。同一节点可以有多条出边（分支），按声明顺序遍历。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class ExecutionEdge {
    private final String fromInstanceId;
    private final String toInstanceId;

    @JsonCreator
    public ExecutionEdge(@JsonProperty("fromInstanceId") String fromInstanceId,
                         @JsonProperty("toInstanceId") String toInstanceId) {
        this.fromInstanceId = Objects.requireNonNull(fromInstanceId, "执行边起点不能为空");
        this.toInstanceId = Objects.requireNonNull(toInstanceId, "执行边终点不能为空");
    }

    @Override
    public String toString() {
        return fromInstanceId + " => " + toInstanceId;
    }
}
