package xyz.vvrf.graph.codegen.core.exception;

import lombok.Getter;

/**
 * 节点类型 ID 未在节点库中注册。
 */
@Getter
public class UnknownNodeTypeException extends CodegenException {
    private final String typeId;

    public UnknownNodeTypeException(String graphName, String typeId) {
        super(ErrorKind.UNKNOWN_NODE_TYPE, graphName,
                String.format("节点类型 '%s' 未在节点库中注册。", typeId));
        this.typeId = typeId;
    }
}
