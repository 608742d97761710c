package xyz.vvrf.graph.codegen.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.engine.GenerationRequest;

import java.time.Duration;

/**
 * 以日志形式输出生成事件。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingGenerationListener implements GenerationListener {

    @Override
    public void onStart(GenerationRequest request) {
        log.info("[MONITOR] 请求:[{}] 类型:[{}] 名称:[{}] 开始生成。",
                request.getRequestId(), request.getKind(), request.getName());
    }

    @Override
    public void onSuccess(GenerationRequest request, Duration duration, int sourceSize) {
        log.info("[MONITOR] 请求:[{}] 类型:[{}] 名称:[{}] 成功。 耗时:[{}ms], 源码长度:[{}]",
                request.getRequestId(), request.getKind(), request.getName(), duration.toMillis(), sourceSize);
    }

    @Override
    public void onFailure(GenerationRequest request, Duration duration, Throwable error) {
        log.warn("[MONITOR] 请求:[{}] 类型:[{}] 名称:[{}] 失败。 耗时:[{}ms], 错误:[{}] {}",
                request.getRequestId(), request.getKind(), request.getName(), duration.toMillis(),
                error.getClass().getSimpleName(), error.getMessage());
    }
}
