package xyz.vvrf.graph.codegen.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.exception.CodegenException;
import xyz.vvrf.graph.codegen.engine.GenerationRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 把生成耗时与次数记录为 Micrometer 指标。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerGenerationListener implements GenerationListener {

    // 指标名称
    public static final String METRIC_GENERATION_TIME = "graph.codegen.generation.time";
    public static final String METRIC_GENERATION_TOTAL = "graph.codegen.generation.total";

    // 标签键
    public static final String TAG_KIND = "kind";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerGenerationListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onSuccess(GenerationRequest request, Duration duration, int sourceSize) {
        Tags tags = Tags.of(
                Tag.of(TAG_KIND, request.getKind().name()),
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_ERROR, "none")
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onFailure(GenerationRequest request, Duration duration, Throwable error) {
        // 生成错误按错误种类归类，其他异常按类名
        String errorTagValue = error instanceof CodegenException
                ? ((CodegenException) error).getKind().name()
                : error.getClass().getSimpleName();
        Tags tags = Tags.of(
                Tag.of(TAG_KIND, request.getKind().name()),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_GENERATION_TIME)
                    .tags(tags)
                    .description("节点图代码生成耗时")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_GENERATION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的代码生成总次数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
