package xyz.vvrf.graph.codegen.core;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次代码生成的配置选项。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public final class GenerationConfig {

    /**
     * 导入方式：DEFAULT 使用星号导入整个 prelude；EXPLICIT 只导入实际用到的名称。
     */
    public enum ImportMode {
        DEFAULT, EXPLICIT
    }

    public enum Preset {
        SERVER, CLIENT;

        /**
         * 头部文档与载荷中使用的小写名称。
         */
        public String label() {
            return name().toLowerCase();
        }
    }

    /**
     * 引导方式：WORKSPACE 注入项目根目录与资源根目录到搜索路径并从预设模块导入；
     * NONE 不注入路径，从同目录的本地 prelude 模块导入。
     */
    public enum BootstrapMode {
        WORKSPACE, NONE
    }

    @Builder.Default
    private final ImportMode importMode = ImportMode.DEFAULT;

    @Builder.Default
    private final Preset preset = Preset.SERVER;

    @Builder.Default
    private final boolean validate = true;

    /** 校验入口覆盖，格式 "模块路径:函数名"，为 null 时使用配置的默认入口 */
    private final String validatorEntryOverride;

    @Builder.Default
    private final BootstrapMode bootstrapMode = BootstrapMode.WORKSPACE;

    public static GenerationConfig defaults() {
        return GenerationConfig.builder().build();
    }
}
