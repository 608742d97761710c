package xyz.vvrf.graph.codegen.monitor;

import xyz.vvrf.graph.codegen.engine.GenerationRequest;

import java.time.Duration;

/**
 * 监听代码生成事件的接口。
 * 监听器抛出的异常由引擎记录并忽略，不影响生成结果。
 *
 * @author ruifeng.wen
 */
public interface GenerationListener {

    /**
     * 生成开始前调用。
     *
     * @param request 生成请求
     */
    default void onStart(GenerationRequest request) {
    }

    /**
     * 生成成功后调用。
     *
     * @param request    生成请求
     * @param duration   生成耗时
     * @param sourceSize 生成源码的字符数
     */
    default void onSuccess(GenerationRequest request, Duration duration, int sourceSize) {
    }

    /**
     * 生成失败后调用，异常随后会原样抛给调用方。
     *
     * @param request  生成请求
     * @param duration 失败前的耗时
     * @param error    原始异常
     */
    default void onFailure(GenerationRequest request, Duration duration, Throwable error) {
    }
}
