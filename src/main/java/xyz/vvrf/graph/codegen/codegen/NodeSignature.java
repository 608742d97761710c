package xyz.vvrf.graph.codegen.codegen;

import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.graph.codegen.core.BindingKind;
import xyz.vvrf.graph.codegen.core.NodeDescriptor;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;

import java.util.List;

/**
 * 签名检查的结果：参数列表中的上下文标记已按约定重新计算。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
public final class NodeSignature {
    private final NodeDescriptor descriptor;
    private final List<ParamDescriptor> parameters;
    private final List<String> outputPins;
    /** 调用名词干：节点库提供的导出别名，没有时为显示名 */
    private final String callStem;

    NodeSignature(NodeDescriptor descriptor, List<ParamDescriptor> parameters, List<String> outputPins, String callStem) {
        this.descriptor = descriptor;
        this.parameters = List.copyOf(parameters);
        this.outputPins = List.copyOf(outputPins);
        this.callStem = callStem;
    }

    public String getTypeId() {
        return descriptor.getTypeId();
    }

    public boolean isVariadic() {
        return parameters.stream().anyMatch(p -> p.getBindingKind() == BindingKind.VARIADIC);
    }

    public boolean requiresContextHandle() {
        return !parameters.isEmpty() && parameters.get(0).isRequiresContextHandle();
    }
}
