package xyz.vvrf.graph.codegen.codegen;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * 配置解析结果：模块头部的导入语句与可选的校验装饰器。
 *
 * @author ruifeng.wen
 */
@Getter
public final class GenerationPreamble {
    private final List<String> importLines;
    private final String validationDecorator;

    GenerationPreamble(List<String> importLines, String validationDecorator) {
        this.importLines = List.copyOf(importLines);
        this.validationDecorator = validationDecorator;
    }

    public Optional<String> validationDecorator() {
        return Optional.ofNullable(validationDecorator);
    }
}
