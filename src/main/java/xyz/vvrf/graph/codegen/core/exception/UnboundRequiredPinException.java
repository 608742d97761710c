package xyz.vvrf.graph.codegen.core.exception;

import lombok.Getter;

/**
 * 必需参数既没有可解析的绑定也没有默认值。
 */
@Getter
public class UnboundRequiredPinException extends CodegenException {
    private final String instanceId;
    private final String pinName;

    public UnboundRequiredPinException(String graphName, String instanceId, String pinName) {
        super(ErrorKind.UNBOUND_REQUIRED_PIN, graphName,
                String.format("节点 '%s' 的必需端口 '%s' 未绑定且没有默认值。", instanceId, pinName));
        this.instanceId = instanceId;
        this.pinName = pinName;
    }
}
