package xyz.vvrf.graph.codegen.registry;

import xyz.vvrf.graph.codegen.core.ParamDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * 节点库接口（外部协作方）。
 * 负责管理节点类型 ID 到节点元数据的映射。代码生成只需要读访问，
 * 实现在生成期间必须保持不变，或保证并发读取安全。
 *
 * @author ruifeng.wen
 */
public interface NodeLibrary {

    /**
     * 注册一个节点类型。
     *
     * @param metadata 节点元数据 (不能为空)
     * @throws IllegalArgumentException 如果类型 ID 已被注册
     */
    void register(NodeMetadata metadata);

    /**
     * 获取指定节点类型的元数据。
     *
     * @param typeId 节点类型 ID (不能为空)
     * @return 元数据的 Optional，未注册时为空
     */
    Optional<NodeMetadata> getNodeMetadata(String typeId);

    /**
     * 节点库版本号，每次注册后递增。生成器可据此发现生成期间节点库被修改。
     */
    long getVersion();

    /**
     * 节点的有序参数签名。
     */
    default Optional<List<ParamDescriptor>> signatureOf(String typeId) {
        return getNodeMetadata(typeId).map(NodeMetadata::getParameters);
    }

    /**
     * 运行时导出的调用别名，使生成的调用名与运行时实际导出的名称一致。
     */
    default Optional<String> callIdentifierAlias(String typeId) {
        return getNodeMetadata(typeId).map(NodeMetadata::getCallAlias);
    }
}
