package xyz.vvrf.graph.codegen.codegen;

import xyz.vvrf.graph.codegen.core.PortRef;

import java.util.*;

/**
 * 一个生成方法体的局部状态：输出缓冲、局部变量冲突表、已求值输出到变量名的映射，
 * 以及本方法内已发出（或正在发出）的节点。每个依赖在一个方法内只求值一次。
 *
 * @author ruifeng.wen
 */
public class MethodScope {

    /** 复合节点外部输入引脚的伪节点 ID */
    public static final String EXTERNAL_INPUTS = "$inputs";

    private final SourceWriter writer;
    private final IdentifierResolver variables;
    private final Map<PortRef, String> outputs = new HashMap<>();
    private final Map<PortRef, String> inputOverrides = new HashMap<>();
    private final Set<String> emitted = new HashSet<>();
    private final Set<String> inProgress = new HashSet<>();

    MethodScope(SourceWriter writer, IdentifierResolver variables) {
        this.writer = writer;
        this.variables = variables;
    }

    public SourceWriter writer() {
        return writer;
    }

    public String freshVariable(String stem) {
        return variables.fresh(stem).getIdentifier();
    }

    public void bindOutput(PortRef port, String variable) {
        outputs.put(port, variable);
    }

    public Optional<String> lookupOutput(PortRef port) {
        return Optional.ofNullable(outputs.get(port));
    }

    /**
     * 把内部节点的某个输入端口改为读取复合节点的外部输入引脚。
     */
    public void overrideInput(PortRef internalPort, String externalPinName, String variable) {
        inputOverrides.put(internalPort, externalPinName);
        outputs.put(PortRef.of(EXTERNAL_INPUTS, externalPinName), variable);
    }

    public Map<String, String> inputOverridesFor(String instanceId) {
        Map<String, String> result = new LinkedHashMap<>();
        inputOverrides.forEach((port, pin) -> {
            if (port.getInstanceId().equals(instanceId)) {
                result.put(port.getPinName(), pin);
            }
        });
        return result;
    }

    public boolean isEmitted(String instanceId) {
        return emitted.contains(instanceId);
    }

    public void markEmitted(String instanceId) {
        inProgress.remove(instanceId);
        emitted.add(instanceId);
    }

    /**
     * @return false 表示该节点已在当前依赖链上（环）
     */
    boolean enter(String instanceId) {
        return inProgress.add(instanceId);
    }

    public Set<String> emittedInstances() {
        return Collections.unmodifiableSet(emitted);
    }
}
