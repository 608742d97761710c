package xyz.vvrf.graph.codegen.codegen;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 标识符解析结果。
 * UNIQUE 表示净化后的词干直接可用；SUFFIXED 表示词干与本轮已发放的标识符冲突，追加了数字后缀。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class ResolvedIdentifier {

    public enum Kind {
        UNIQUE, SUFFIXED
    }

    private final Kind kind;
    private final String rawText;
    private final String stem;
    /** UNIQUE 时为 0 */
    private final int suffix;

    private ResolvedIdentifier(Kind kind, String rawText, String stem, int suffix) {
        this.kind = kind;
        this.rawText = rawText;
        this.stem = stem;
        this.suffix = suffix;
    }

    static ResolvedIdentifier unique(String rawText, String stem) {
        return new ResolvedIdentifier(Kind.UNIQUE, rawText, stem, 0);
    }

    static ResolvedIdentifier suffixed(String rawText, String stem, int suffix) {
        return new ResolvedIdentifier(Kind.SUFFIXED, rawText, stem, suffix);
    }

    public String getIdentifier() {
        return kind == Kind.UNIQUE ? stem : stem + "_" + suffix;
    }

    @Override
    public String toString() {
        return getIdentifier();
    }
}
