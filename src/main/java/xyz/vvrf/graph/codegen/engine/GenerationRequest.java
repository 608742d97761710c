package xyz.vvrf.graph.codegen.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;

import java.util.Objects;
import java.util.UUID;

/**
 * 一次生成请求：一个图或一个复合节点，加上可选的生成配置。
 * 配置为 null 时由引擎使用默认配置。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class GenerationRequest {

    public enum Kind {
        GRAPH, COMPOSITE
    }

    private final String requestId;
    private final Kind kind;
    private final GraphIR graph;
    private final CompositeConfig composite;
    private final GenerationConfig config;

    private GenerationRequest(String requestId, Kind kind, GraphIR graph, CompositeConfig composite, GenerationConfig config) {
        this.requestId = (requestId != null && !requestId.trim().isEmpty()) ? requestId : UUID.randomUUID().toString();
        this.kind = kind;
        this.graph = graph;
        this.composite = composite;
        this.config = config;
    }

    public static GenerationRequest ofGraph(GraphIR graph, GenerationConfig config) {
        return ofGraph(null, graph, config);
    }

    public static GenerationRequest ofGraph(String requestId, GraphIR graph, GenerationConfig config) {
        Objects.requireNonNull(graph, "图不能为空");
        return new GenerationRequest(requestId, Kind.GRAPH, graph, null, config);
    }

    public static GenerationRequest ofComposite(CompositeConfig composite, GenerationConfig config) {
        return ofComposite(null, composite, config);
    }

    public static GenerationRequest ofComposite(String requestId, CompositeConfig composite, GenerationConfig config) {
        Objects.requireNonNull(composite, "复合节点配置不能为空");
        return new GenerationRequest(requestId, Kind.COMPOSITE, null, composite, config);
    }

    /**
     * 日志与指标中使用的名称：图名或复合节点名。
     */
    public String getName() {
        return kind == Kind.GRAPH ? graph.getGraphName() : composite.getNodeName();
    }
}
