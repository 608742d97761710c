package xyz.vvrf.graph.codegen.engine;

import reactor.core.publisher.Flux;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;

/**
 * 代码生成入口。
 * 单次生成是同步的纯计算：相同输入、相同节点库、相同配置得到逐字节相同的输出。
 *
 * @author ruifeng.wen
 */
public interface CodeGenerationEngine {

    /**
     * 生成图脚本。
     *
     * @param graph  图 IR
     * @param config 生成配置，为 null 时使用引擎默认配置
     * @return 完整的脚本源码
     * @throws xyz.vvrf.graph.codegen.core.exception.CodegenException 生成失败时，原样抛出
     */
    String generateGraph(GraphIR graph, GenerationConfig config);

    /**
     * 生成复合节点类源码。
     *
     * @param composite 复合节点配置
     * @param config    生成配置，为 null 时使用引擎默认配置
     * @return 完整的复合节点源码
     * @throws xyz.vvrf.graph.codegen.core.exception.CodegenException 生成失败时，原样抛出
     */
    String generateComposite(CompositeConfig composite, GenerationConfig config);

    /**
     * 执行单个请求，失败时返回携带原始异常的结果而不抛出。
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * 在调度器上并发执行一批互不相关的请求，结果按请求顺序发出。
     * 失败的处理方式由引擎的 {@link BatchFailureStrategy} 决定。
     */
    Flux<GenerationResult> generateAll(Flux<GenerationRequest> requests);
}
