package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 图对外暴露的事件/信号绑定：信号名与其入口节点实例。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SignalBinding {
    private final String signalName;
    private final String entryInstanceId;

    @JsonCreator
    public SignalBinding(@JsonProperty("signalName") String signalName,
                         @JsonProperty("entryInstanceId") String entryInstanceId) {
        this.signalName = Objects.requireNonNull(signalName, "信号名不能为空");
        this.entryInstanceId = Objects.requireNonNull(entryInstanceId, "信号入口节点不能为空");
    }
}
