package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 模板字符串（插值文本）的一个片段：原样文本、字面量值或对其他节点输出的引用。
 *
 * @author ruifeng.wen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TemplatePart {

    public enum Kind {
        TEXT, LITERAL, REFERENCE
    }

    private final Kind kind;
    private final String text;
    private final LiteralValue literal;
    private final PortRef source;

    @JsonCreator
    TemplatePart(@JsonProperty("kind") Kind kind,
                 @JsonProperty("text") String text,
                 @JsonProperty("literal") LiteralValue literal,
                 @JsonProperty("source") PortRef source) {
        this.kind = Objects.requireNonNull(kind, "模板片段类型不能为空");
        this.text = text;
        this.literal = literal;
        this.source = source;
        if ((kind == Kind.TEXT && text == null)
                || (kind == Kind.LITERAL && literal == null)
                || (kind == Kind.REFERENCE && source == null)) {
            throw new IllegalArgumentException("模板片段 " + kind + " 缺少对应的值");
        }
        if (kind == Kind.LITERAL && literal.isContainer()) {
            throw new IllegalArgumentException("模板插值不支持容器字面量: " + literal);
        }
    }

    public static TemplatePart text(String text) {
        return new TemplatePart(Kind.TEXT, text, null, null);
    }

    public static TemplatePart literal(LiteralValue literal) {
        return new TemplatePart(Kind.LITERAL, null, literal, null);
    }

    public static TemplatePart reference(String instanceId, String pinName) {
        return new TemplatePart(Kind.REFERENCE, null, null, PortRef.of(instanceId, pinName));
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public LiteralValue getLiteral() {
        return literal;
    }

    public PortRef getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplatePart that = (TemplatePart) o;
        return kind == that.kind && Objects.equals(text, that.text)
                && Objects.equals(literal, that.literal) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, literal, source);
    }

    @Override
    public String toString() {
        return "TemplatePart[" + kind + ":" + (text != null ? text : literal != null ? literal : source) + "]";
    }
}
