package xyz.vvrf.graph.codegen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 端口上的字面量默认值（不可变数据类）。
 * 容器类（LIST / MAP）的值在生成调用时必须先提升为独立的命名变量，不能直接出现在参数列表中。
 *
 * @author ruifeng.wen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LiteralValue {

    public enum Kind {
        STRING, INTEGER, FLOAT, BOOLEAN, NONE, LIST, MAP
    }

    private static final LiteralValue NONE_VALUE = new LiteralValue(Kind.NONE, null, null, null, null, null, null);

    private final Kind kind;
    private final String text;
    private final Long integer;
    private final Double number;
    private final Boolean bool;
    private final List<LiteralValue> items;
    private final Map<String, LiteralValue> entries;

    @JsonCreator
    LiteralValue(@JsonProperty("kind") Kind kind,
                 @JsonProperty("text") String text,
                 @JsonProperty("integer") Long integer,
                 @JsonProperty("number") Double number,
                 @JsonProperty("bool") Boolean bool,
                 @JsonProperty("items") List<LiteralValue> items,
                 @JsonProperty("entries") Map<String, LiteralValue> entries) {
        this.kind = Objects.requireNonNull(kind, "字面量类型不能为空");
        this.text = text;
        this.integer = integer;
        this.number = number;
        this.bool = bool;
        this.items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
        this.entries = entries == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        checkPayload();
    }

    public static LiteralValue ofString(String text) {
        return new LiteralValue(Kind.STRING, Objects.requireNonNull(text, "字符串字面量不能为 null"), null, null, null, null, null);
    }

    public static LiteralValue ofInteger(long value) {
        return new LiteralValue(Kind.INTEGER, null, value, null, null, null, null);
    }

    public static LiteralValue ofFloat(double value) {
        return new LiteralValue(Kind.FLOAT, null, null, value, null, null, null);
    }

    public static LiteralValue ofBoolean(boolean value) {
        return new LiteralValue(Kind.BOOLEAN, null, null, null, value, null, null);
    }

    public static LiteralValue none() {
        return NONE_VALUE;
    }

    public static LiteralValue ofList(List<LiteralValue> items) {
        return new LiteralValue(Kind.LIST, null, null, null, null, Objects.requireNonNull(items, "列表元素不能为空"), null);
    }

    public static LiteralValue ofMap(Map<String, LiteralValue> entries) {
        return new LiteralValue(Kind.MAP, null, null, null, null, null, Objects.requireNonNull(entries, "字典条目不能为空"));
    }

    private void checkPayload() {
        boolean ok;
        switch (kind) {
            case STRING: ok = text != null; break;
            case INTEGER: ok = integer != null; break;
            case FLOAT: ok = number != null; break;
            case BOOLEAN: ok = bool != null; break;
            case LIST: ok = items != null; break;
            case MAP: ok = entries != null; break;
            default: ok = true;
        }
        if (!ok) {
            throw new IllegalArgumentException("字面量 " + kind + " 缺少对应的值");
        }
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public Long getInteger() {
        return integer;
    }

    public Double getNumber() {
        return number;
    }

    public Boolean getBool() {
        return bool;
    }

    public List<LiteralValue> getItems() {
        return items;
    }

    public Map<String, LiteralValue> getEntries() {
        return entries;
    }

    /**
     * 是否为容器类字面量（列表或字典）。
     */
    @JsonIgnore
    public boolean isContainer() {
        return kind == Kind.LIST || kind == Kind.MAP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LiteralValue that = (LiteralValue) o;
        return kind == that.kind
                && Objects.equals(text, that.text)
                && Objects.equals(integer, that.integer)
                && Objects.equals(number, that.number)
                && Objects.equals(bool, that.bool)
                && Objects.equals(items, that.items)
                && Objects.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, integer, number, bool, items, entries);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING: return "'" + text + "'";
            case INTEGER: return String.valueOf(integer);
            case FLOAT: return String.valueOf(number);
            case BOOLEAN: return String.valueOf(bool);
            case LIST: return String.valueOf(items);
            case MAP: return String.valueOf(entries);
            default: return "None";
        }
    }
}
