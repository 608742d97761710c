package xyz.vvrf.graph.codegen.core;

/**
 * 节点函数参数的绑定方式。
 *
 * @author ruifeng.wen
 */
public enum BindingKind {
    /**
     * 只能按位置传入的参数。
     */
    POSITIONAL,

    /**
     * 可以按关键字传入的参数（端口名需为合法的关键字参数名）。
     */
    KEYWORD,

    /**
     * 变参：收集实例上以十进制序号命名的端口（"0"、"1"...），按序号依次按位置传入。
     */
    VARIADIC
}
