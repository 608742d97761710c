package xyz.vvrf.graph.codegen.codegen;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 生成代码导入的运行时模块名。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public final class PreludeModules {
    @Builder.Default
    private final String serverModule = "runtime.engine.graph_prelude_server";
    @Builder.Default
    private final String clientModule = "runtime.engine.graph_prelude_client";
    /** 与生成文件同目录的 prelude，不注入搜索路径时使用 */
    @Builder.Default
    private final String localModule = "_prelude";
    @Builder.Default
    private final String validatorModule = "engine.validate.node_graph_validator";
    @Builder.Default
    private final String validatorEntry = "validate_node_graph";

    public static PreludeModules defaults() {
        return PreludeModules.builder().build();
    }
}
