package xyz.vvrf.graph.codegen.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.graph.codegen.codegen.CompositeCodeEmitter;
import xyz.vvrf.graph.codegen.codegen.GraphCodeEmitter;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.monitor.GenerationListener;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 标准代码生成引擎：把请求分派给图或复合节点发射器，通知监听器，
 * 失败时记录一次错误日志后原样抛出异常。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardCodeGenerationEngine implements CodeGenerationEngine {

    private final GraphCodeEmitter graphEmitter;
    private final CompositeCodeEmitter compositeEmitter;
    @Getter
    private final GenerationConfig defaultConfig;
    private final List<GenerationListener> listeners;
    private final Scheduler scheduler;
    private final int concurrency;
    @Getter
    private final BatchFailureStrategy failureStrategy;

    public StandardCodeGenerationEngine(GraphCodeEmitter graphEmitter,
                                        CompositeCodeEmitter compositeEmitter,
                                        GenerationConfig defaultConfig,
                                        List<GenerationListener> listeners,
                                        Scheduler scheduler,
                                        int concurrency,
                                        BatchFailureStrategy failureStrategy) {
        this.graphEmitter = Objects.requireNonNull(graphEmitter, "图发射器不能为空");
        this.compositeEmitter = Objects.requireNonNull(compositeEmitter, "复合节点发射器不能为空");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "默认生成配置不能为空");
        this.listeners = listeners != null ? List.copyOf(listeners) : Collections.emptyList();
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("批量并发度必须为正数");
        }
        this.concurrency = concurrency;
        this.failureStrategy = Objects.requireNonNull(failureStrategy, "批量失败策略不能为空");
        log.info("StandardCodeGenerationEngine 已初始化。 默认配置: {}, 监听器数量: {}, 批量并发度: {}, 失败策略: {}",
                defaultConfig, this.listeners.size(), concurrency, failureStrategy);
    }

    @Override
    public String generateGraph(GraphIR graph, GenerationConfig config) {
        return sourceOrThrow(generate(GenerationRequest.ofGraph(graph, config)));
    }

    @Override
    public String generateComposite(CompositeConfig composite, GenerationConfig config) {
        return sourceOrThrow(generate(GenerationRequest.ofComposite(composite, config)));
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "生成请求不能为空");
        GenerationConfig config = request.getConfig() != null ? request.getConfig() : defaultConfig;
        safeNotifyListeners(l -> l.onStart(request));
        long start = System.nanoTime();
        try {
            String source = request.getKind() == GenerationRequest.Kind.GRAPH
                    ? graphEmitter.emitGraph(request.getGraph(), config)
                    : compositeEmitter.emitComposite(request.getComposite(), config);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            log.debug("[RequestId: {}] '{}' 生成完成，耗时 {}ms", request.getRequestId(), request.getName(), duration.toMillis());
            safeNotifyListeners(l -> l.onSuccess(request, duration, source.length()));
            return GenerationResult.success(request, source, duration);
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            log.error("[RequestId: {}] '{}' ({}) 生成失败: {}", request.getRequestId(), request.getName(),
                    request.getKind(), e.getMessage(), e);
            safeNotifyListeners(l -> l.onFailure(request, duration, e));
            return GenerationResult.failure(request, e, duration);
        }
    }

    @Override
    public Flux<GenerationResult> generateAll(Flux<GenerationRequest> requests) {
        Objects.requireNonNull(requests, "请求流不能为空");
        return requests.flatMapSequential(request -> Mono.fromCallable(() -> generate(request))
                        .subscribeOn(scheduler)
                        .flatMap(this::applyFailureStrategy),
                concurrency);
    }

    private Mono<GenerationResult> applyFailureStrategy(GenerationResult result) {
        if (!result.isSuccess() && failureStrategy == BatchFailureStrategy.FAIL_FAST) {
            return Mono.error(result.getError());
        }
        return Mono.just(result);
    }

    private static String sourceOrThrow(GenerationResult result) {
        if (result.isSuccess()) {
            return result.getSource();
        }
        // generate 只捕获 RuntimeException
        throw (RuntimeException) result.getError();
    }

    private void safeNotifyListeners(Consumer<GenerationListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (GenerationListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("生成监听器 {} 抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
