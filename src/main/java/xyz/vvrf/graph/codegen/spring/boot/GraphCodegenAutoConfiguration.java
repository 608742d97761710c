package xyz.vvrf.graph.codegen.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.graph.codegen.codegen.CompositeCodeEmitter;
import xyz.vvrf.graph.codegen.codegen.CompositePayloadCodec;
import xyz.vvrf.graph.codegen.codegen.ExpressionEmitter;
import xyz.vvrf.graph.codegen.codegen.GenerationConfigResolver;
import xyz.vvrf.graph.codegen.codegen.GraphCodeEmitter;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.engine.CodeGenerationEngine;
import xyz.vvrf.graph.codegen.engine.StandardCodeGenerationEngine;
import xyz.vvrf.graph.codegen.monitor.GenerationListener;
import xyz.vvrf.graph.codegen.monitor.LoggingGenerationListener;
import xyz.vvrf.graph.codegen.monitor.MicrometerGenerationListener;
import xyz.vvrf.graph.codegen.registry.NodeLibrary;
import xyz.vvrf.graph.codegen.registry.SimpleNodeLibrary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 节点图代码生成框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link GraphCodegenProperties}。
 * 2. 提供配置解析器、载荷编解码器、两个发射器与默认生成配置。
 * 3. 提供批量生成使用的调度器 "graphCodegenScheduler"，类型由属性配置。
 * 4. 存在 MeterRegistry 时注册 Micrometer 监听器。
 * 5. 提供 {@link CodeGenerationEngine}，并按顺序注入上下文中的全部 {@link GenerationListener}。
 * <p>
 * 应用未声明 {@link NodeLibrary} 时注册一个空的 {@link SimpleNodeLibrary}，
 * 通常应声明一个 {@link xyz.vvrf.graph.codegen.registry.SpringScanningNodeLibrary} 或自行注册节点。
 * 所有 Bean 均可被应用覆盖。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(GraphCodegenProperties.class)
@Slf4j
public class GraphCodegenAutoConfiguration {

    public GraphCodegenAutoConfiguration() {
        log.info("节点图代码生成自动配置 (GraphCodegenAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean(NodeLibrary.class)
    public NodeLibrary graphCodegenNodeLibrary() {
        log.warn("应用上下文中没有 NodeLibrary Bean，使用空的 SimpleNodeLibrary。请注册节点或声明自己的节点库。");
        return new SimpleNodeLibrary("default");
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationConfigResolver generationConfigResolver(GraphCodegenProperties properties) {
        return new GenerationConfigResolver(properties.getPrelude().toPreludeModules());
    }

    @Bean
    @ConditionalOnMissingBean
    public CompositePayloadCodec compositePayloadCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new CompositePayloadCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEmitter graphCodegenExpressionEmitter() {
        return new ExpressionEmitter();
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationConfig defaultGenerationConfig(GraphCodegenProperties properties) {
        GenerationConfig config = properties.getDefaults().toGenerationConfig();
        log.info("默认生成配置: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphCodeEmitter graphCodeEmitter(NodeLibrary library, GenerationConfigResolver resolver,
                                             ExpressionEmitter expressions, GraphCodegenProperties properties) {
        return new GraphCodeEmitter(library, resolver, expressions, properties.getSignatureCache().getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public CompositeCodeEmitter compositeCodeEmitter(NodeLibrary library, GenerationConfigResolver resolver,
                                                     ExpressionEmitter expressions, CompositePayloadCodec codec,
                                                     GraphCodegenProperties properties) {
        return new CompositeCodeEmitter(library, resolver, expressions, codec, properties.getSignatureCache().getMaximumSize());
    }

    /**
     * 批量生成使用的调度器。已存在同名 Bean 时不创建。
     */
    @Bean(name = "graphCodegenScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "graphCodegenScheduler")
    public Scheduler graphCodegenScheduler(GraphCodegenProperties properties) {
        GraphCodegenProperties.SchedulerProps schedulerProps = properties.getBatch().getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                GraphCodegenProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 'graphCodegenScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 'graphCodegenScheduler' (Single): prefix={}", namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case BOUNDED_ELASTIC:
            default:
                GraphCodegenProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 'graphCodegenScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                        namePrefix, beProps.getTtlSeconds(), true);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "graph.codegen.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingGenerationListener loggingGenerationListener() {
        return new LoggingGenerationListener();
    }

    @Bean
    @ConditionalOnMissingBean(CodeGenerationEngine.class)
    public CodeGenerationEngine codeGenerationEngine(GraphCodeEmitter graphEmitter,
                                                     CompositeCodeEmitter compositeEmitter,
                                                     GenerationConfig defaultGenerationConfig,
                                                     ObjectProvider<GenerationListener> listenersProvider,
                                                     @Qualifier("graphCodegenScheduler") Scheduler scheduler,
                                                     GraphCodegenProperties properties) {
        log.info("正在创建 CodeGenerationEngine Bean，配置: {}", properties);
        List<GenerationListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 GenerationListener Bean。");
        } else {
            log.info("找到 {} 个 GenerationListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.toList()));
        }
        return new StandardCodeGenerationEngine(graphEmitter, compositeEmitter, defaultGenerationConfig,
                listeners, scheduler,
                properties.getBatch().getConcurrency(), properties.getBatch().getFailureStrategy());
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerGenerationListener micrometerGenerationListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，注册 MicrometerGenerationListener。");
            return new MicrometerGenerationListener(meterRegistry);
        }
    }
}
