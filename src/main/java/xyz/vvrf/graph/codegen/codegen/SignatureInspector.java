package xyz.vvrf.graph.codegen.codegen;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;
import xyz.vvrf.graph.codegen.core.exception.UnknownNodeTypeException;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.registry.NodeMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 从节点库读取节点签名，并重新计算上下文参数标记：
 * 只有第一个声明参数且名称等于 {@link #CONTEXT_PARAM_NAME} 时才需要传入上下文句柄，
 * 纯查询节点因此不会收到未声明的上下文参数。
 * <p>
 * 每次生成持有自己的实例，缓存只在本轮内有效。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SignatureInspector {

    public static final String CONTEXT_PARAM_NAME = "game";

    private final NodeLibrary library;
    private final String graphName;
    private final Cache<String, NodeSignature> cache;

    public SignatureInspector(NodeLibrary library, String graphName, long maximumCacheSize) {
        this.library = Objects.requireNonNull(library, "节点库不能为空");
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumCacheSize)
                .build();
    }

    /**
     * 返回节点类型的签名。
     *
     * @throws UnknownNodeTypeException 节点类型未注册
     */
    public NodeSignature inspect(String typeId) {
        Objects.requireNonNull(typeId, "节点类型 ID 不能为空");
        NodeSignature cached = cache.getIfPresent(typeId);
        if (cached != null) {
            log.debug("图 '{}': 节点类型 '{}' 的签名命中缓存", graphName, typeId);
            return cached;
        }
        return cache.get(typeId, this::load);
    }

    public List<ParamDescriptor> signatureOf(String typeId) {
        return inspect(typeId).getParameters();
    }

    private NodeSignature load(String typeId) {
        NodeMetadata metadata = library.getNodeMetadata(typeId)
                .orElseThrow(() -> new UnknownNodeTypeException(graphName, typeId));

        List<ParamDescriptor> declared = metadata.getParameters();
        List<ParamDescriptor> params = new ArrayList<>(declared.size());
        for (int i = 0; i < declared.size(); i++) {
            ParamDescriptor p = declared.get(i);
            boolean context = i == 0 && CONTEXT_PARAM_NAME.equals(p.getRawName());
            params.add(p.withContextHandle(context));
        }
        String callStem = library.callIdentifierAlias(typeId)
                .orElse(metadata.getDescriptor().getDisplayName());
        NodeSignature signature = new NodeSignature(metadata.getDescriptor(), params, metadata.getOutputPins(), callStem);
        log.debug("图 '{}': 已加载节点类型 '{}' 的签名 (参数: {}, 上下文: {}, 变参: {})",
                graphName, typeId, params.size(), signature.requiresContextHandle(), signature.isVariadic());
        return signature;
    }
}
