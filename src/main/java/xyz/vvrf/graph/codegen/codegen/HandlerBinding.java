package xyz.vvrf.graph.codegen.codegen;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

/**
 * 信号与其事件处理方法的对应关系。
 * 处理方法定义与注册语句都从同一个对象生成，两者的名称一致由构造保证。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HandlerBinding {

    public static final String HANDLER_SUFFIX = "_handler";

    private final String signalName;
    private final String entryInstanceId;
    private final ResolvedIdentifier signalIdentifier;

    HandlerBinding(String signalName, String entryInstanceId, ResolvedIdentifier signalIdentifier) {
        this.signalName = signalName;
        this.entryInstanceId = entryInstanceId;
        this.signalIdentifier = signalIdentifier;
    }

    public String getMethodName() {
        return signalIdentifier.getIdentifier() + HANDLER_SUFFIX;
    }

    public String registrationStatement() {
        return "self.game.register_event_handler(" + PythonSyntax.quote(signalName)
                + ", self." + getMethodName() + ", owner=self.owner_entity)";
    }
}
