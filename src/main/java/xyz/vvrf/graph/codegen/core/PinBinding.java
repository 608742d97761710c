package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 节点实例上某个输入端口的绑定：另一个实例的输出端口、字面量、模板字符串或未绑定。
 *
 * @author ruifeng.wen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PinBinding {

    public enum Kind {
        OUTPUT, LITERAL, TEMPLATE, UNBOUND
    }

    private static final PinBinding UNBOUND_BINDING = new PinBinding(Kind.UNBOUND, null, null, null);

    private final Kind kind;
    private final PortRef source;
    private final LiteralValue literal;
    private final List<TemplatePart> template;

    @JsonCreator
    PinBinding(@JsonProperty("kind") Kind kind,
               @JsonProperty("source") PortRef source,
               @JsonProperty("literal") LiteralValue literal,
               @JsonProperty("template") List<TemplatePart> template) {
        this.kind = Objects.requireNonNull(kind, "绑定类型不能为空");
        this.source = source;
        this.literal = literal;
        this.template = template == null ? null : Collections.unmodifiableList(new ArrayList<>(template));
        if ((kind == Kind.OUTPUT && source == null)
                || (kind == Kind.LITERAL && literal == null)
                || (kind == Kind.TEMPLATE && template == null)) {
            throw new IllegalArgumentException("端口绑定 " + kind + " 缺少对应的值");
        }
    }

    public static PinBinding output(String instanceId, String pinName) {
        return new PinBinding(Kind.OUTPUT, PortRef.of(instanceId, pinName), null, null);
    }

    public static PinBinding literal(LiteralValue value) {
        return new PinBinding(Kind.LITERAL, null, Objects.requireNonNull(value, "字面量不能为空"), null);
    }

    public static PinBinding template(List<TemplatePart> parts) {
        return new PinBinding(Kind.TEMPLATE, null, null, Objects.requireNonNull(parts, "模板片段不能为空"));
    }

    public static PinBinding unbound() {
        return UNBOUND_BINDING;
    }

    public Kind getKind() {
        return kind;
    }

    public PortRef getSource() {
        return source;
    }

    public LiteralValue getLiteral() {
        return literal;
    }

    public List<TemplatePart> getTemplate() {
        return template;
    }

    /**
     * 此绑定引用到的所有上游输出端口（输出绑定本身或模板中的引用片段）。
     */
    @JsonIgnore
    public Set<PortRef> referencedOutputs() {
        if (kind == Kind.OUTPUT) {
            return Collections.singleton(source);
        }
        if (kind != Kind.TEMPLATE) {
            return Collections.emptySet();
        }
        Set<PortRef> refs = new LinkedHashSet<>();
        for (TemplatePart part : template) {
            if (part.getKind() == TemplatePart.Kind.REFERENCE) {
                refs.add(part.getSource());
            }
        }
        return refs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PinBinding that = (PinBinding) o;
        return kind == that.kind && Objects.equals(source, that.source)
                && Objects.equals(literal, that.literal) && Objects.equals(template, that.template);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, source, literal, template);
    }

    @Override
    public String toString() {
        switch (kind) {
            case OUTPUT: return "PinBinding[->" + source + "]";
            case LITERAL: return "PinBinding[" + literal + "]";
            case TEMPLATE: return "PinBinding[template" + template + "]";
            default: return "PinBinding[unbound]";
        }
    }
}
