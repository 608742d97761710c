package xyz.vvrf.graph.codegen.codegen;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.graph.codegen.core.LiteralValue;
import xyz.vvrf.graph.codegen.core.PinBinding;

/**
 * 一次调用中的一个实参：槽位种类、关键字名（仅 KEYWORD）与取值来源。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
@ToString
public final class BoundArgument {

    public enum Slot {
        CONTEXT, POSITIONAL, KEYWORD
    }

    private static final BoundArgument CONTEXT_ARGUMENT = new BoundArgument(Slot.CONTEXT, null, null, null);

    private final Slot slot;
    private final String keyword;
    /** 取值来源；CONTEXT 槽位为 null */
    private final PinBinding value;
    /** 来源端口名，用于给提升出的中间变量命名 */
    private final String pinName;

    private BoundArgument(Slot slot, String keyword, PinBinding value, String pinName) {
        this.slot = slot;
        this.keyword = keyword;
        this.value = value;
        this.pinName = pinName;
    }

    public static BoundArgument context() {
        return CONTEXT_ARGUMENT;
    }

    public static BoundArgument positional(String pinName, PinBinding value) {
        return new BoundArgument(Slot.POSITIONAL, null, value, pinName);
    }

    public static BoundArgument keyword(String keyword, PinBinding value) {
        return new BoundArgument(Slot.KEYWORD, keyword, value, keyword);
    }

    /**
     * 位置参数中间缺省的可选参数占位。
     */
    static BoundArgument placeholder(String pinName) {
        return positional(pinName, PinBinding.literal(LiteralValue.none()));
    }
}
