package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.NodeInstance;
import xyz.vvrf.graph.codegen.core.PinBinding;
import xyz.vvrf.graph.codegen.core.PortRef;
import xyz.vvrf.graph.codegen.core.exception.CyclicDependencyException;

import java.util.*;

/**
 * 在方法作用域内发出单个节点的调用语句。
 * 先发出尚未求值的数据依赖（每个依赖在一个方法内只发出一次，紧挨在首个消费者之前），
 * 再发出节点本身，并把它的输出端口绑定到新分配的局部变量。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class NodeStatementEmitter {

    private final GenerationSession session;
    private final ExpressionEmitter expressions;

    public NodeStatementEmitter(GenerationSession session, ExpressionEmitter expressions) {
        this.session = Objects.requireNonNull(session, "生成会话不能为空");
        this.expressions = Objects.requireNonNull(expressions, "表达式发射器不能为空");
    }

    public void emit(String instanceId, MethodScope scope) {
        if (scope.isEmitted(instanceId)) {
            return;
        }
        // 显式栈上的后序遍历：依赖全部发出后才发出节点本身
        Deque<PendingNode> stack = new ArrayDeque<>();
        stack.push(enter(instanceId, scope));
        while (!stack.isEmpty()) {
            PendingNode pending = stack.peek();
            if (pending.producers.hasNext()) {
                String producer = pending.producers.next();
                if (!scope.isEmitted(producer)) {
                    log.debug("图 '{}': 为节点 '{}' 先发出依赖 '{}'", session.getGraphName(), pending.instanceId, producer);
                    stack.push(enter(producer, scope));
                }
            } else {
                stack.pop();
                emitCall(pending.instanceId, scope);
            }
        }
    }

    private PendingNode enter(String instanceId, MethodScope scope) {
        if (session.isEntryNode(instanceId)) {
            throw new IllegalStateException(String.format("图 '%s': 事件入口节点 '%s' 的输出只能在它自己的事件处理器中引用。",
                    session.getGraphName(), instanceId));
        }
        if (!scope.enter(instanceId)) {
            // 发出前已做过全局检查，这里只在依赖表与检查不一致时触发
            throw new CyclicDependencyException(session.getGraphName(), Collections.singleton(instanceId));
        }
        return new PendingNode(instanceId, session.producersOf(instanceId).iterator());
    }

    private void emitCall(String instanceId, MethodScope scope) {
        NodeInstance node = effectiveNode(instanceId, scope);
        NodeSignature signature = session.getInspector().inspect(node.getTypeId());
        String identifier = session.callIdentifierFor(signature);
        List<BoundArgument> args = session.getBinder().bind(node, signature);
        String call = expressions.emitCall(identifier, args, scope);

        List<String> outputs = signature.getOutputPins();
        if (outputs.isEmpty()) {
            scope.writer().line(call);
        } else {
            List<String> names = new ArrayList<>(outputs.size());
            for (String pin : outputs) {
                String variable = scope.freshVariable(pin);
                scope.bindOutput(PortRef.of(instanceId, pin), variable);
                names.add(variable);
            }
            scope.writer().line(String.join(", ", names) + " = " + call);
        }
        scope.markEmitted(instanceId);
        log.debug("图 '{}': 已发出节点 '{}' -> {}", session.getGraphName(), instanceId, identifier);
    }

    /**
     * 应用复合节点外部输入引脚对内部端口的覆盖。
     */
    private NodeInstance effectiveNode(String instanceId, MethodScope scope) {
        NodeInstance node = session.getGraph().findNode(instanceId)
                .orElseThrow(() -> new IllegalStateException(String.format("图 '%s': 找不到节点实例 '%s'。",
                        session.getGraphName(), instanceId)));
        Map<String, String> overrides = scope.inputOverridesFor(instanceId);
        if (overrides.isEmpty()) {
            return node;
        }
        Map<String, PinBinding> bindings = new LinkedHashMap<>(node.getBindings());
        overrides.forEach((pin, externalPin) ->
                bindings.put(pin, PinBinding.output(MethodScope.EXTERNAL_INPUTS, externalPin)));
        return new NodeInstance(node.getInstanceId(), node.getTypeId(), bindings);
    }

    private static final class PendingNode {
        private final String instanceId;
        private final Iterator<String> producers;

        private PendingNode(String instanceId, Iterator<String> producers) {
            this.instanceId = instanceId;
            this.producers = producers;
        }
    }
}
