package xyz.vvrf.graph.codegen.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.graph.codegen.annotation.GraphNodeType;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.NodeDescriptor;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个 {@link NodeLibrary} 实现，它会自动发现并注册使用 {@link GraphNodeType} 注解的 Spring Bean。
 * <p>
 * 初始化后扫描 ApplicationContext，注册那些 {@link GraphNodeType#scopes()} 包含本节点库作用域的声明。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningNodeLibrary implements NodeLibrary, ApplicationContextAware, InitializingBean {

    private final GenerationConfig.Preset scope;
    private ApplicationContext applicationContext;
    private final SimpleNodeLibrary delegate;

    public SpringScanningNodeLibrary(GenerationConfig.Preset scope) {
        this.scope = Objects.requireNonNull(scope, "节点库作用域不能为空");
        this.delegate = new SimpleNodeLibrary(scope.label());
        log.info("为作用域 '{}' 创建了 SpringScanningNodeLibrary", scope.label());
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningNodeLibrary (作用域: " + scope.label() + ") 中 ApplicationContext 未设置");
        }
        log.info("开始为作用域 '{}' 扫描 @GraphNodeType Bean...", scope.label());
        scanAndRegister();
    }

    private void scanAndRegister() {
        Map<String, Object> beans = applicationContext.getBeansWithAnnotation(GraphNodeType.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();
            GraphNodeType annotation = applicationContext.findAnnotationOnBean(beanName, GraphNodeType.class);
            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @GraphNodeType 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (Arrays.stream(annotation.scopes()).noneMatch(s -> s == scope)) {
                continue;
            }
            if (!(bean instanceof NodeDeclaration)) {
                log.error("Bean '{}' 使用了 @GraphNodeType 注解，但未实现 NodeDeclaration 接口。跳过注册。", beanName);
                continue;
            }

            String typeId = determineTypeId(annotation, beanName);
            NodeDeclaration declaration = (NodeDeclaration) bean;
            try {
                delegate.register(NodeMetadata.builder()
                        .descriptor(NodeDescriptor.of(typeId, declaration.getDisplayName(), declaration.getCategory()))
                        .parameters(declaration.getParameters())
                        .outputPins(declaration.getOutputPins())
                        .callAlias(declaration.getCallAlias())
                        .build());
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 重复 ID 等注册错误不中断扫描
                log.error("注册节点 Bean '{}' (ID: '{}', 作用域: '{}') 失败: {}",
                        beanName, typeId, scope.label(), e.getMessage());
            }
        }
        log.info("作用域 '{}' 的扫描完成。共注册了 {} 个节点。", scope.label(), registeredCount);
    }

    private String determineTypeId(GraphNodeType annotation, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (id.isEmpty()) {
            log.warn("Bean '{}' 的 @GraphNodeType 注解中未提供 'id' 或 'value'。将使用 Bean 名称作为节点类型 ID。", beanName);
            return beanName;
        }
        return id;
    }

    public GenerationConfig.Preset getScope() {
        return scope;
    }

    @Override
    public void register(NodeMetadata metadata) {
        log.warn("尝试在 SpringScanningNodeLibrary 上手动注册 ID '{}'。推荐使用自动扫描。", metadata.getTypeId());
        delegate.register(metadata);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String typeId) {
        return delegate.getNodeMetadata(typeId);
    }

    @Override
    public long getVersion() {
        return delegate.getVersion();
    }
}
