package xyz.vvrf.graph.codegen.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 节点函数的单个参数描述。
 * 一个节点的完整签名是 ParamDescriptor 的有序序列。
 * <p>
 * requiresContextHandle 仅在参数为第一个声明参数且名称为上下文参数约定名时为 true，
 * 由 {@link xyz.vvrf.graph.codegen.codegen.SignatureInspector} 重新计算，节点库提供的值不作数。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ParamDescriptor {
    private final String rawName;
    private final BindingKind bindingKind;
    private final boolean requiresContextHandle;
    private final boolean required;
    /** 未绑定时使用的默认值，可为 null */
    private final LiteralValue defaultValue;

    private ParamDescriptor(String rawName, BindingKind bindingKind, boolean requiresContextHandle,
                            boolean required, LiteralValue defaultValue) {
        this.rawName = Objects.requireNonNull(rawName, "参数名不能为空");
        this.bindingKind = Objects.requireNonNull(bindingKind, "参数绑定方式不能为空");
        this.requiresContextHandle = requiresContextHandle;
        this.required = required;
        this.defaultValue = defaultValue;
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("必需参数 '" + rawName + "' 不能声明默认值");
        }
    }

    public static ParamDescriptor required(String rawName, BindingKind kind) {
        return new ParamDescriptor(rawName, kind, false, true, null);
    }

    public static ParamDescriptor optional(String rawName, BindingKind kind, LiteralValue defaultValue) {
        return new ParamDescriptor(rawName, kind, false, false, defaultValue);
    }

    public static ParamDescriptor variadic(String rawName) {
        return new ParamDescriptor(rawName, BindingKind.VARIADIC, false, false, null);
    }

    /**
     * 上下文参数（按约定名声明在第一位的参数）。
     */
    public static ParamDescriptor context(String rawName) {
        return new ParamDescriptor(rawName, BindingKind.POSITIONAL, true, true, null);
    }

    /**
     * 返回仅 requiresContextHandle 不同的副本。
     */
    public ParamDescriptor withContextHandle(boolean contextHandle) {
        if (contextHandle == requiresContextHandle) {
            return this;
        }
        return new ParamDescriptor(rawName, bindingKind, contextHandle, contextHandle || required,
                contextHandle ? null : defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
