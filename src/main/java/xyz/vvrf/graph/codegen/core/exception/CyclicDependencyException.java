package xyz.vvrf.graph.codegen.core.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 数据依赖无法线性化（存在环）。
 */
@Getter
public class CyclicDependencyException extends CodegenException {
    /** 参与或位于环下游、无法排序的节点实例 ID */
    private final Set<String> unsortedInstanceIds;

    public CyclicDependencyException(String graphName, Set<String> unsortedInstanceIds) {
        super(ErrorKind.CYCLIC_DEPENDENCY, graphName,
                String.format("数据依赖存在环，无法排序的节点: %s", new TreeSet<>(unsortedInstanceIds)));
        this.unsortedInstanceIds = Collections.unmodifiableSet(new TreeSet<>(unsortedInstanceIds));
    }
}
