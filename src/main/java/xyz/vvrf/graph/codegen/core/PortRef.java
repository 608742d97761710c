package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 指向某个节点实例上某个端口的引用（不可变数据类）。
 *
 * @author ruifeng.wen
 */
public final class PortRef {
    private final String instanceId;
    private final String pinName;

    @JsonCreator
    public PortRef(@JsonProperty("instanceId") String instanceId,
                   @JsonProperty("pinName") String pinName) {
        this.instanceId = Objects.requireNonNull(instanceId, "节点实例 ID 不能为空");
        this.pinName = Objects.requireNonNull(pinName, "端口名不能为空");
    }

    public static PortRef of(String instanceId, String pinName) {
        return new PortRef(instanceId, pinName);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getPinName() {
        return pinName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortRef portRef = (PortRef) o;
        return instanceId.equals(portRef.instanceId) && pinName.equals(portRef.pinName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceId, pinName);
    }

    @Override
    public String toString() {
        return instanceId + "[" + pinName + "]";
    }
}
