package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.text.Normalizer;
import java.util.*;

/**
 * 把任意显示文本转换为唯一且合法的标识符。
 * <p>
 * 同一张冲突表内：相同的原始文本总是得到相同的标识符；不同原始文本净化后词干相同时，
 * 按首次出现顺序分配，先到者保留词干，后到者依次追加 {@code _2}、{@code _3}...
 * 冲突表只属于一次生成，不在线程间共享，因此本类不是线程安全的。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class IdentifierResolver {

    /** 输入净化后为空时使用的词干 */
    public static final String PLACEHOLDER_STEM = "node";

    private final String namespace;
    private final Map<String, ResolvedIdentifier> byRawText = new HashMap<>();
    private final Set<String> taken = new HashSet<>();
    private final List<String> issued = new ArrayList<>();
    /** 每个词干下次尝试的后缀，小于它的后缀都已被占用 */
    private final Map<String, Integer> nextSuffix = new HashMap<>();

    /**
     * @param namespace 命名空间，仅用于日志
     * @param reserved  本命名空间内不可使用的名称
     */
    public IdentifierResolver(String namespace, Collection<String> reserved) {
        this.namespace = Objects.requireNonNull(namespace, "命名空间不能为空");
        this.taken.addAll(reserved);
    }

    public IdentifierResolver(String namespace) {
        this(namespace, Collections.emptySet());
    }

    /**
     * 解析显示文本。相同文本重复解析返回同一结果。
     */
    public ResolvedIdentifier resolve(String displayName) {
        String raw = displayName == null ? "" : displayName;
        ResolvedIdentifier existing = byRawText.get(raw);
        if (existing != null) {
            return existing;
        }
        ResolvedIdentifier resolved = allocate(raw);
        byRawText.put(raw, resolved);
        return resolved;
    }

    /**
     * 总是发放一个新标识符，即使同样的文本之前已解析过。用于局部变量等每次都需要新名称的场合。
     */
    public ResolvedIdentifier fresh(String stemText) {
        return allocate(stemText == null ? "" : stemText);
    }

    public Optional<ResolvedIdentifier> lookup(String displayName) {
        return Optional.ofNullable(byRawText.get(displayName == null ? "" : displayName));
    }

    /**
     * 按发放顺序返回本表已发放的全部标识符。
     */
    public List<String> issuedIdentifiers() {
        return Collections.unmodifiableList(issued);
    }

    private ResolvedIdentifier allocate(String raw) {
        String stem = sanitize(raw);
        ResolvedIdentifier resolved;
        if (taken.add(stem)) {
            resolved = ResolvedIdentifier.unique(raw, stem);
        } else {
            int suffix = nextSuffix.getOrDefault(stem, 2);
            while (!taken.add(stem + "_" + suffix)) {
                suffix++;
            }
            nextSuffix.put(stem, suffix + 1);
            resolved = ResolvedIdentifier.suffixed(raw, stem, suffix);
            log.debug("[{}] '{}' 净化后与已有标识符冲突，分配为 '{}'", namespace, raw, resolved.getIdentifier());
        }
        issued.add(resolved.getIdentifier());
        return resolved;
    }

    /**
     * 把任意文本净化为合法标识符词干（不处理冲突）。
     * 非法字符替换为下划线，折叠连续下划线并去除首尾下划线；为空时使用占位词干；
     * 首字符不能作为标识符开头（如数字）时添加 {@code node_} 前缀；关键字末尾追加下划线。
     */
    public static String sanitize(String text) {
        String normalized = Normalizer.normalize(text == null ? "" : text, Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(cp -> {
            if (PythonSyntax.isIdentifierPart(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });
        String result = sb.toString().replaceAll("_+", "_");
        result = stripUnderscores(result);
        if (result.isEmpty()) {
            return PLACEHOLDER_STEM;
        }
        if (!PythonSyntax.isIdentifierStart(result.codePointAt(0))) {
            result = PLACEHOLDER_STEM + "_" + result;
        }
        if (PythonSyntax.isKeyword(result)) {
            result = result + "_";
        }
        return result;
    }

    /**
     * 把任意名称转换为驼峰形式的类名；首字符非字母时添加 {@code G_} 前缀，结果为空时回退为 {@code NodeGraph}。
     */
    public static String sanitizeClassName(String name) {
        String normalized = Normalizer.normalize(name == null ? "" : name, Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(cp -> sb.appendCodePoint(PythonSyntax.isIdentifierPart(cp) ? cp : '_'));
        String sanitized = sb.toString();
        if (!sanitized.isEmpty() && !Character.isLetter(sanitized.codePointAt(0))) {
            sanitized = "G_" + sanitized;
        }
        StringBuilder className = new StringBuilder();
        for (String word : sanitized.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            int first = word.codePointAt(0);
            className.appendCodePoint(Character.toUpperCase(first))
                    .append(word.substring(Character.charCount(first)).toLowerCase(Locale.ROOT));
        }
        return className.length() == 0 ? "NodeGraph" : className.toString();
    }

    private static String stripUnderscores(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '_') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '_') {
            end--;
        }
        return text.substring(start, end);
    }
}
