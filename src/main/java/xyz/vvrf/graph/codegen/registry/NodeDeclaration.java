package xyz.vvrf.graph.codegen.registry;

import xyz.vvrf.graph.codegen.core.ParamDescriptor;

import java.util.Collections;
import java.util.List;

/**
 * 以 Spring Bean 形式声明的节点类型。
 * 与 {@link xyz.vvrf.graph.codegen.annotation.GraphNodeType} 一起使用，
 * 由 {@link SpringScanningNodeLibrary} 发现并注册。
 *
 * @author ruifeng.wen
 */
public interface NodeDeclaration {

    String getDisplayName();

    List<ParamDescriptor> getParameters();

    default String getCategory() {
        return "";
    }

    default List<String> getOutputPins() {
        return Collections.emptyList();
    }

    default String getCallAlias() {
        return null;
    }
}
