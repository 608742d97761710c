package xyz.vvrf.graph.codegen.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;
import xyz.vvrf.graph.codegen.core.GenerationConfig;

import java.lang.annotation.*;

/**
 * 标记一个类为可被发现的节点类型声明。
 * 使用此注解且实现了 {@link xyz.vvrf.graph.codegen.registry.NodeDeclaration} 的 Bean，
 * 如果 {@link #scopes()} 包含节点库的作用域，将被
 * {@link xyz.vvrf.graph.codegen.registry.SpringScanningNodeLibrary} 自动注册。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface GraphNodeType {

    /**
     * 节点类型 ID，同时也是 {@link #id()} 的别名。
     */
    @AliasFor("id")
    String value() default "";

    @AliasFor("value")
    String id() default "";

    /**
     * 节点可用的作用域。
     */
    GenerationConfig.Preset[] scopes() default {GenerationConfig.Preset.SERVER, GenerationConfig.Preset.CLIENT};
}
