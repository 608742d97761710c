package xyz.vvrf.graph.codegen.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.graph.codegen.codegen.PreludeModules;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.engine.BatchFailureStrategy;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 代码生成框架的配置属性，绑定 'graph.codegen' 前缀。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graph.codegen")
@Validated
public class GraphCodegenProperties {

    @Valid
    private final Defaults defaults = new Defaults();
    @Valid
    private final Prelude prelude = new Prelude();
    @Valid
    private final SignatureCache signatureCache = new SignatureCache();
    @Valid
    private final Batch batch = new Batch();

    /**
     * 未显式传入生成配置时使用的默认值。
     */
    @Getter
    @Setter
    public static class Defaults {
        @NotNull
        private GenerationConfig.ImportMode importMode = GenerationConfig.ImportMode.DEFAULT;
        @NotNull
        private GenerationConfig.Preset preset = GenerationConfig.Preset.SERVER;
        private boolean validate = true;
        /**
         * 校验入口覆盖，格式 "模块路径:函数名"。
         */
        private String validatorEntry;
        @NotNull
        private GenerationConfig.BootstrapMode bootstrapMode = GenerationConfig.BootstrapMode.WORKSPACE;

        public GenerationConfig toGenerationConfig() {
            return GenerationConfig.builder()
                    .importMode(importMode)
                    .preset(preset)
                    .validate(validate)
                    .validatorEntryOverride(validatorEntry != null && !validatorEntry.trim().isEmpty() ? validatorEntry.trim() : null)
                    .bootstrapMode(bootstrapMode)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Prelude {
        @NotBlank
        private String serverModule = "runtime.engine.graph_prelude_server";
        @NotBlank
        private String clientModule = "runtime.engine.graph_prelude_client";
        @NotBlank
        private String localModule = "_prelude";
        @NotBlank
        private String validatorModule = "engine.validate.node_graph_validator";
        @NotBlank
        private String validatorEntry = "validate_node_graph";

        public PreludeModules toPreludeModules() {
            return PreludeModules.builder()
                    .serverModule(serverModule)
                    .clientModule(clientModule)
                    .localModule(localModule)
                    .validatorModule(validatorModule)
                    .validatorEntry(validatorEntry)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class SignatureCache {
        /**
         * 单次生成内签名缓存的最大条目数。
         */
        @Min(1)
        private long maximumSize = 1024;
    }

    @Getter
    @Setter
    public static class Batch {
        /**
         * 批量生成时同时进行的生成数。
         */
        @Min(1)
        private int concurrency = Math.max(1, Runtime.getRuntime().availableProcessors());

        @NotNull
        private BatchFailureStrategy failureStrategy = BatchFailureStrategy.FAIL_FAST;

        @Valid
        private final SchedulerProps scheduler = new SchedulerProps();
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        private String namePrefix = "graph-codegen";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Override
    public String toString() {
        return "GraphCodegenProperties{" +
                "defaults={importMode=" + defaults.importMode +
                ", preset=" + defaults.preset +
                ", validate=" + defaults.validate +
                ", validatorEntry='" + defaults.validatorEntry + '\'' +
                ", bootstrapMode=" + defaults.bootstrapMode +
                "}, prelude={server='" + prelude.serverModule + '\'' +
                ", client='" + prelude.clientModule + '\'' +
                ", local='" + prelude.localModule + '\'' +
                "}, signatureCache={maximumSize=" + signatureCache.maximumSize +
                "}, batch={concurrency=" + batch.concurrency +
                ", failureStrategy=" + batch.failureStrategy +
                ", scheduler=" + batch.scheduler.type +
                "}}";
    }
}
