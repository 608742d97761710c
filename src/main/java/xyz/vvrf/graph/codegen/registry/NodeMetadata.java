package xyz.vvrf.graph.codegen.registry;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import xyz.vvrf.graph.codegen.core.BindingKind;
import xyz.vvrf.graph.codegen.core.NodeDescriptor;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * 节点库中单个节点类型的静态信息：描述、有序参数签名、输出端口与导出别名。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class NodeMetadata {
    private final NodeDescriptor descriptor;
    private final List<ParamDescriptor> parameters;
    private final List<String> outputPins;
    /** 运行时导出的调用名，为 null 时由显示名派生 */
    private final String callAlias;

    @Builder
    private NodeMetadata(NodeDescriptor descriptor,
                         @Singular List<ParamDescriptor> parameters,
                         @Singular List<String> outputPins,
                         String callAlias) {
        this.descriptor = Objects.requireNonNull(descriptor, "节点描述不能为空");
        this.parameters = List.copyOf(parameters);
        this.outputPins = List.copyOf(outputPins);
        this.callAlias = callAlias == null || callAlias.isBlank() ? null : callAlias;
        long variadicCount = this.parameters.stream().filter(p -> p.getBindingKind() == BindingKind.VARIADIC).count();
        if (variadicCount > 1) {
            throw new IllegalArgumentException("节点类型 '" + descriptor.getTypeId() + "' 声明了多个变参参数");
        }
    }

    public String getTypeId() {
        return descriptor.getTypeId();
    }

    /**
     * 签名中是否包含变参参数。
     */
    public boolean isVariadic() {
        return parameters.stream().anyMatch(p -> p.getBindingKind() == BindingKind.VARIADIC);
    }

    @Override
    public String toString() {
        return String.format("Metadata[type=%s, params=%d, outputs=%d]",
                descriptor.getTypeId(), parameters.size(), outputPins.size());
    }
}
