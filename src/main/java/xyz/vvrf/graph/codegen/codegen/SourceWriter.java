package xyz.vvrf.graph.codegen.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按行累积源码文本，管理缩进层级（每级 4 个空格）。
 *
 * @author ruifeng.wen
 */
public class SourceWriter {

    private static final String INDENT_UNIT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int level;

    public SourceWriter() {
        this(0);
    }

    public SourceWriter(int initialLevel) {
        this.level = initialLevel;
    }

    public SourceWriter line(String text) {
        lines.add(text.isEmpty() ? "" : INDENT_UNIT.repeat(level) + text);
        return this;
    }

    public SourceWriter blank() {
        lines.add("");
        return this;
    }

    /**
     * 原样追加已排好缩进的行，不再加当前缩进。
     */
    public SourceWriter raw(String text) {
        lines.add(text);
        return this;
    }

    public SourceWriter append(SourceWriter other) {
        lines.addAll(other.lines);
        return this;
    }

    public SourceWriter indent() {
        level++;
        return this;
    }

    public SourceWriter dedent() {
        if (level == 0) {
            throw new IllegalStateException("缩进层级已为 0");
        }
        level--;
        return this;
    }

    public int mark() {
        return lines.size();
    }

    /**
     * 若自 mark 以来没有写入任何非空行，则写入 {@code pass}。
     */
    public SourceWriter passIfEmptySince(int mark) {
        boolean empty = lines.subList(mark, lines.size()).stream().allMatch(String::isBlank);
        if (empty) {
            line("pass");
        }
        return this;
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    @Override
    public String toString() {
        return String.join("\n", lines) + "\n";
    }
}
