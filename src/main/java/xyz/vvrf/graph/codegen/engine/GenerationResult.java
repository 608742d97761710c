package xyz.vvrf.graph.codegen.engine;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次生成的结果。成功时携带源码，失败时携带原始异常。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString(exclude = "source")
public final class GenerationResult {

    private final GenerationRequest request;
    private final String source;
    private final Throwable error;
    private final Duration duration;

    private GenerationResult(GenerationRequest request, String source, Throwable error, Duration duration) {
        this.request = Objects.requireNonNull(request, "请求不能为空");
        this.source = source;
        this.error = error;
        this.duration = Objects.requireNonNull(duration, "耗时不能为空");
    }

    public static GenerationResult success(GenerationRequest request, String source, Duration duration) {
        return new GenerationResult(request, Objects.requireNonNull(source, "源码不能为空"), null, duration);
    }

    public static GenerationResult failure(GenerationRequest request, Throwable error, Duration duration) {
        return new GenerationResult(request, null, Objects.requireNonNull(error, "异常不能为空"), duration);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> getSourceOptional() {
        return Optional.ofNullable(source);
    }
}
