package xyz.vvrf.graph.codegen.core.exception;

/**
 * 复合节点配置无法序列化，或序列化后无法解析回等价的配置。
 */
public class CompositePayloadSerializationException extends CodegenException {

    public CompositePayloadSerializationException(String compositeName, String message) {
        super(ErrorKind.COMPOSITE_PAYLOAD_SERIALIZATION_FAILURE, compositeName, message);
    }

    public CompositePayloadSerializationException(String compositeName, String message, Throwable cause) {
        super(ErrorKind.COMPOSITE_PAYLOAD_SERIALIZATION_FAILURE, compositeName, message, cause);
    }
}
