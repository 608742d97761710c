package xyz.vvrf.graph.codegen.core.exception;

import lombok.Getter;

/**
 * 代码生成失败的基类。
 * 在检测点立即抛出并原样传播给调用方，失败的生成不产出任何可用文本。
 *
 * @author ruifeng.wen
 */
@Getter
public abstract class CodegenException extends IllegalStateException {

    public enum ErrorKind {
        UNKNOWN_NODE_TYPE,
        UNBOUND_REQUIRED_PIN,
        VARIADIC_POSITIONAL_FALLBACK_DISALLOWED,
        CYCLIC_DEPENDENCY,
        COMPOSITE_PAYLOAD_SERIALIZATION_FAILURE
    }

    private final ErrorKind kind;
    private final String graphName;

    protected CodegenException(ErrorKind kind, String graphName, String message) {
        super(String.format("图 '%s': %s", graphName, message));
        this.kind = kind;
        this.graphName = graphName;
    }

    protected CodegenException(ErrorKind kind, String graphName, String message, Throwable cause) {
        super(String.format("图 '%s': %s", graphName, message), cause);
        this.kind = kind;
        this.graphName = graphName;
    }
}
