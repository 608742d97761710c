package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 数据边：生产者的调用结果必须先求值并绑定到名称，消费者才能引用它。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class DataEdge {
    private final String producerInstanceId;
    private final String consumerInstanceId;

    @JsonCreator
    public DataEdge(@JsonProperty("producerInstanceId") String producerInstanceId,
                    @JsonProperty("consumerInstanceId") String consumerInstanceId) {
        this.producerInstanceId = Objects.requireNonNull(producerInstanceId, "数据边生产者不能为空");
        this.consumerInstanceId = Objects.requireNonNull(consumerInstanceId, "数据边消费者不能为空");
    }

    @Override
    public String toString() {
        return producerInstanceId + " -> " + consumerInstanceId;
    }
}
