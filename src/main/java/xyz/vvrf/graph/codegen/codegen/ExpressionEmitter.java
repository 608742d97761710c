package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.LiteralValue;
import xyz.vvrf.graph.codegen.core.PinBinding;
import xyz.vvrf.graph.codegen.core.PortRef;
import xyz.vvrf.graph.codegen.core.TemplatePart;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把绑定好的调用渲染为源码文本。
 * <p>
 * 调用的实参列表中永远不出现容器字面量：列表与字典值先在前置语句中构造并绑定到名称，
 * 实参只引用该名称。模板字符串的插值位置中不放任何需要转义或引号的表达式，
 * 这类值先赋给中间变量，插值处只写变量名。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ExpressionEmitter {

    public static final String CONTEXT_EXPRESSION = "self.game";

    private static final String BUILTINS = GenerationConfigResolver.BUILTINS_ALIAS;

    /**
     * 渲染调用表达式，必要的前置语句写入作用域。
     */
    public String emitCall(String identifier, List<BoundArgument> args, MethodScope scope) {
        List<String> rendered = new ArrayList<>(args.size());
        for (BoundArgument arg : args) {
            switch (arg.getSlot()) {
                case CONTEXT:
                    rendered.add(CONTEXT_EXPRESSION);
                    break;
                case KEYWORD:
                    rendered.add(arg.getKeyword() + "=" + render(arg.getValue(), arg.getPinName(), scope));
                    break;
                default:
                    rendered.add(render(arg.getValue(), arg.getPinName(), scope));
            }
        }
        return identifier + "(" + String.join(", ", rendered) + ")";
    }

    /**
     * 渲染单个取值为可直接放入实参列表的表达式。
     *
     * @param stem 提升中间变量时使用的命名词干
     */
    public String render(PinBinding binding, String stem, MethodScope scope) {
        switch (binding.getKind()) {
            case OUTPUT:
                return outputName(binding.getSource(), scope);
            case LITERAL:
                LiteralValue literal = binding.getLiteral();
                return literal.isContainer() ? hoistContainer(literal, stem, scope) : renderScalar(literal);
            case TEMPLATE:
                return renderTemplate(binding.getTemplate(), stem, scope);
            default:
                return "None";
        }
    }

    public String renderScalar(LiteralValue value) {
        switch (value.getKind()) {
            case STRING:
                return PythonSyntax.quote(value.getText());
            case INTEGER:
                return Long.toString(value.getInteger());
            case FLOAT:
                return renderFloat(value.getNumber());
            case BOOLEAN:
                return value.getBool() ? "True" : "False";
            case NONE:
                return "None";
            default:
                throw new IllegalArgumentException("容器字面量必须先提升为命名变量: " + value);
        }
    }

    private static String renderFloat(double number) {
        if (Double.isNaN(number)) {
            return BUILTINS + ".float(\"nan\")";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? BUILTINS + ".float(\"inf\")" : BUILTINS + ".float(\"-inf\")";
        }
        return Double.toString(number);
    }

    /**
     * 用前置语句逐项构造容器并返回其变量名。嵌套容器先于外层构造。
     */
    String hoistContainer(LiteralValue value, String stem, MethodScope scope) {
        List<String> statements = new ArrayList<>();
        String name;
        if (value.getKind() == LiteralValue.Kind.LIST) {
            List<String> items = new ArrayList<>();
            for (LiteralValue item : value.getItems()) {
                items.add(item.isContainer() ? hoistContainer(item, stem, scope) : renderScalar(item));
            }
            name = scope.freshVariable(stem);
            statements.add(name + " = " + BUILTINS + ".list()");
            for (String item : items) {
                statements.add(name + ".append(" + item + ")");
            }
        } else {
            List<String[]> entries = new ArrayList<>();
            for (Map.Entry<String, LiteralValue> entry : value.getEntries().entrySet()) {
                LiteralValue v = entry.getValue();
                entries.add(new String[]{PythonSyntax.quote(entry.getKey()),
                        v.isContainer() ? hoistContainer(v, stem, scope) : renderScalar(v)});
            }
            name = scope.freshVariable(stem);
            statements.add(name + " = " + BUILTINS + ".dict()");
            for (String[] entry : entries) {
                statements.add(name + "[" + entry[0] + "] = " + entry[1]);
            }
        }
        statements.forEach(scope.writer()::line);
        log.debug("容器字面量已提升为变量 '{}'", name);
        return name;
    }

    /**
     * 渲染模板字符串。没有插值片段时退化为普通字符串字面量。
     */
    String renderTemplate(List<TemplatePart> parts, String stem, MethodScope scope) {
        boolean hasHoles = parts.stream().anyMatch(p -> p.getKind() != TemplatePart.Kind.TEXT);
        if (!hasHoles) {
            StringBuilder text = new StringBuilder();
            parts.forEach(p -> text.append(p.getText()));
            return PythonSyntax.quote(text.toString());
        }
        StringBuilder body = new StringBuilder();
        for (TemplatePart part : parts) {
            switch (part.getKind()) {
                case TEXT:
                    body.append(PythonSyntax.escapeTemplateText(part.getText()));
                    break;
                case REFERENCE:
                    body.append('{').append(outputName(part.getSource(), scope)).append('}');
                    break;
                default:
                    String expr = renderScalar(part.getLiteral());
                    if (!isSafeInInterpolation(expr)) {
                        String name = scope.freshVariable(stem);
                        scope.writer().line(name + " = " + expr);
                        log.debug("模板插值值 {} 需要转义，已提升为变量 '{}'", expr, name);
                        expr = name;
                    }
                    body.append('{').append(expr).append('}');
            }
        }
        return "f\"" + body + "\"";
    }

    private static boolean isSafeInInterpolation(String expr) {
        return expr.chars().noneMatch(c -> c == '\\' || c == '"' || c == '\'' || c == '{' || c == '}'
                || c == '\n' || c == '\r');
    }

    private static String outputName(PortRef ref, MethodScope scope) {
        return scope.lookupOutput(ref).orElseThrow(() -> new IllegalStateException(
                String.format("端口 %s 在当前方法中没有可引用的求值结果（节点未声明该输出端口，或属于其他事件流）。", ref)));
    }
}
