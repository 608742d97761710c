package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.BindingKind;
import xyz.vvrf.graph.codegen.core.NodeInstance;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;
import xyz.vvrf.graph.codegen.core.PinBinding;
import xyz.vvrf.graph.codegen.core.exception.UnboundRequiredPinException;
import xyz.vvrf.graph.codegen.core.exception.VariadicPositionalFallbackDisallowedException;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.*;

/**
 * 把节点实例的端口绑定与签名结合，得到有序且合法的实参列表。
 * <ul>
 *   <li>需要上下文句柄时，第一个实参固定为上下文，不查端口绑定。</li>
 *   <li>非变参节点：所有数据参数都可作为关键字且名称合法时用关键字形式，否则整次调用回退为纯位置参数，
 *   同一调用不混用两种形式。</li>
 *   <li>变参节点：变参之前的参数按位置传入，随后是以十进制序号命名的端口（按数值排序），
 *   其余参数以关键字传入。任一非变参参数的名称不能作为关键字时直接失败，不回退为位置参数。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ArgumentBinder {

    private final String graphName;

    public ArgumentBinder(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
    }

    public List<BoundArgument> bind(NodeInstance node, NodeSignature signature) {
        Map<String, PinBinding> pins = normalizedBindings(node);
        List<ParamDescriptor> params = signature.getParameters();

        List<BoundArgument> args = new ArrayList<>();
        int start = 0;
        if (signature.requiresContextHandle()) {
            args.add(BoundArgument.context());
            start = 1;
        }
        List<ParamDescriptor> dataParams = params.subList(start, params.size());

        if (signature.isVariadic()) {
            bindVariadic(node, dataParams, pins, args);
        } else {
            boolean keywordMode = dataParams.stream()
                    .allMatch(p -> p.getBindingKind() == BindingKind.KEYWORD && PythonSyntax.isSafeKeywordName(p.getRawName()));
            if (keywordMode) {
                bindKeywords(node, dataParams, pins, args);
            } else {
                log.debug("图 '{}': 节点 '{}' 的参数无法全部作为关键字，整次调用使用位置参数", graphName, node.getInstanceId());
                bindPositional(node, dataParams, pins, args);
            }
        }
        return args;
    }

    private void bindKeywords(NodeInstance node, List<ParamDescriptor> params,
                              Map<String, PinBinding> pins, List<BoundArgument> args) {
        for (ParamDescriptor param : params) {
            PinBinding value = resolve(node, param, pins);
            if (value != null) {
                args.add(BoundArgument.keyword(PythonSyntax.normalizeName(param.getRawName()), value));
            }
        }
    }

    private void bindPositional(NodeInstance node, List<ParamDescriptor> params,
                                Map<String, PinBinding> pins, List<BoundArgument> args) {
        List<BoundArgument> slots = new ArrayList<>();
        for (ParamDescriptor param : params) {
            PinBinding value = resolve(node, param, pins);
            slots.add(value == null ? null : BoundArgument.positional(param.getRawName(), value));
        }
        // 末尾缺省的可选参数直接省略，中间的用 None 占位
        int last = slots.size() - 1;
        while (last >= 0 && slots.get(last) == null) {
            last--;
        }
        for (int i = 0; i <= last; i++) {
            BoundArgument arg = slots.get(i);
            args.add(arg != null ? arg : BoundArgument.placeholder(params.get(i).getRawName()));
        }
    }

    private void bindVariadic(NodeInstance node, List<ParamDescriptor> params,
                              Map<String, PinBinding> pins, List<BoundArgument> args) {
        int variadicIndex = 0;
        while (params.get(variadicIndex).getBindingKind() != BindingKind.VARIADIC) {
            variadicIndex++;
        }
        List<ParamDescriptor> leading = params.subList(0, variadicIndex);
        List<ParamDescriptor> trailing = params.subList(variadicIndex + 1, params.size());

        // 变参节点不允许位置回退：变参之前的参数名同样必须能作为关键字
        for (ParamDescriptor param : params) {
            if (param.getBindingKind() != BindingKind.VARIADIC && !PythonSyntax.isSafeKeywordName(param.getRawName())) {
                throw new VariadicPositionalFallbackDisallowedException(graphName, node.getInstanceId(), param.getRawName());
            }
        }

        List<BoundArgument> items = variadicItems(pins);
        List<BoundArgument> positional = new ArrayList<>();
        for (ParamDescriptor param : leading) {
            PinBinding value = resolve(node, param, pins);
            positional.add(value == null ? null : BoundArgument.positional(param.getRawName(), value));
        }
        int last = positional.size() - 1;
        if (items.isEmpty()) {
            while (last >= 0 && positional.get(last) == null) {
                last--;
            }
        }
        for (int i = 0; i <= last; i++) {
            BoundArgument arg = positional.get(i);
            args.add(arg != null ? arg : BoundArgument.placeholder(leading.get(i).getRawName()));
        }
        args.addAll(items);
        bindKeywords(node, trailing, pins, args);
    }

    private List<BoundArgument> variadicItems(Map<String, PinBinding> pins) {
        SortedMap<Integer, BoundArgument> items = new TreeMap<>();
        for (Map.Entry<String, PinBinding> entry : pins.entrySet()) {
            String name = entry.getKey();
            if (isIndexName(name) && entry.getValue().getKind() != PinBinding.Kind.UNBOUND) {
                items.put(Integer.parseInt(name), BoundArgument.positional(name, entry.getValue()));
            }
        }
        return new ArrayList<>(items.values());
    }

    private static boolean isIndexName(String name) {
        return !name.isEmpty() && name.length() <= 9 && name.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    /**
     * @return 绑定值；可选参数未绑定且无默认值时为 null
     * @throws UnboundRequiredPinException 必需参数未绑定
     */
    private PinBinding resolve(NodeInstance node, ParamDescriptor param, Map<String, PinBinding> pins) {
        PinBinding binding = pins.get(PythonSyntax.normalizeName(param.getRawName()));
        if (binding != null && binding.getKind() != PinBinding.Kind.UNBOUND) {
            return binding;
        }
        if (param.hasDefault()) {
            return PinBinding.literal(param.getDefaultValue());
        }
        if (param.isRequired()) {
            throw new UnboundRequiredPinException(graphName, node.getInstanceId(), param.getRawName());
        }
        return null;
    }

    private static Map<String, PinBinding> normalizedBindings(NodeInstance node) {
        Map<String, PinBinding> result = new LinkedHashMap<>();
        node.getBindings().forEach((pin, binding) -> result.put(PythonSyntax.normalizeName(pin), binding));
        return result;
    }
}
