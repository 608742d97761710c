package xyz.vvrf.graph.codegen.engine;

/**
 * 批量生成时单个请求失败后的处理方式。
 *
 * @author ruifeng.wen
 */
public enum BatchFailureStrategy {
    /**
     * 第一个失败的请求终止整个批次，原始异常向下游传播。
     */
    FAIL_FAST,

    /**
     * 失败的请求产出携带原始异常的失败结果，其余请求继续生成。
     */
    CONTINUE_ON_FAILURE
}
