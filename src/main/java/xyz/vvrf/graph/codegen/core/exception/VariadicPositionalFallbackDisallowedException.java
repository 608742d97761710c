package xyz.vvrf.graph.codegen.core.exception;

import lombok.Getter;

/**
 * 变参节点的端口名无法构成合法的关键字参数名。
 * 变参签名依赖关键字对应关系，不允许回退为位置参数。
 */
@Getter
public class VariadicPositionalFallbackDisallowedException extends CodegenException {
    private final String instanceId;
    private final String pinName;

    public VariadicPositionalFallbackDisallowedException(String graphName, String instanceId, String pinName) {
        super(ErrorKind.VARIADIC_POSITIONAL_FALLBACK_DISALLOWED, graphName,
                String.format("变参节点 '%s' 的端口名 '%s' 不是合法的关键字参数名，不能回退为位置参数。",
                        instanceId, pinName));
        this.instanceId = instanceId;
        this.pinName = pinName;
    }
}
