package xyz.vvrf.graph.codegen.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NodeLibrary 的简单内存实现。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleNodeLibrary implements NodeLibrary {

    private final String name;
    private final Map<String, NodeMetadata> metadataMap = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public SimpleNodeLibrary() {
        this("default");
    }

    /**
     * @param name 节点库名称，仅用于日志
     */
    public SimpleNodeLibrary(String name) {
        this.name = Objects.requireNonNull(name, "节点库名称不能为空");
        log.info("SimpleNodeLibrary '{}' 已创建", name);
    }

    @Override
    public void register(NodeMetadata metadata) {
        Objects.requireNonNull(metadata, "节点元数据不能为空");
        String typeId = metadata.getTypeId();
        if (metadataMap.putIfAbsent(typeId, metadata) != null) {
            throw new IllegalArgumentException(String.format("节点类型 ID '%s' 在节点库 '%s' 中已存在。", typeId, name));
        }
        long v = version.incrementAndGet();
        log.info("节点库 '{}': 已注册节点类型 '{}' (显示名: '{}', 参数: {}, 版本: {})",
                name, typeId, metadata.getDescriptor().getDisplayName(), metadata.getParameters().size(), v);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String typeId) {
        Objects.requireNonNull(typeId, "节点类型 ID 不能为空");
        return Optional.ofNullable(metadataMap.get(typeId));
    }

    @Override
    public long getVersion() {
        return version.get();
    }

    public int size() {
        return metadataMap.size();
    }
}
