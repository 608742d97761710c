package xyz.vvrf.graph.codegen.util;

import java.text.Normalizer;
import java.util.Set;

/**
 * 目标语言（Python）的词法规则：关键字、标识符合法性与字符串字面量转义。
 * 所有输出面向仍受支持的最低语法版本。
 *
 * @author ruifeng.wen
 */
public final class PythonSyntax {

    private PythonSyntax() {}

    /** 硬关键字。软关键字（match、case、type、_）可以作为标识符，不在此列 */
    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    /** 空字符串的唯一拼写 */
    public static final String EMPTY_STRING_LITERAL = "\"\"";

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * 判断文本是否为合法标识符（不检查关键字）。
     */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int first = text.codePointAt(0);
        if (!isIdentifierStart(first)) {
            return false;
        }
        return text.codePoints().skip(1).allMatch(PythonSyntax::isIdentifierPart);
    }

    public static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isLetter(codePoint)
                || Character.getType(codePoint) == Character.LETTER_NUMBER;
    }

    public static boolean isIdentifierPart(int codePoint) {
        if (Character.isIdentifierIgnorable(codePoint) || codePoint == '$') {
            return false;
        }
        return isIdentifierStart(codePoint) || Character.isUnicodeIdentifierPart(codePoint);
    }

    /**
     * 端口名去除首尾空白并做 NFKC 规范化（与 Python 解析标识符时相同）后，能否作为关键字参数名。
     */
    public static boolean isSafeKeywordName(String rawName) {
        String text = normalizeName(rawName);
        return isIdentifier(text) && !isKeyword(text);
    }

    public static String normalizeName(String rawName) {
        if (rawName == null) {
            return "";
        }
        return Normalizer.normalize(rawName.strip(), Normalizer.Form.NFKC);
    }

    /**
     * 渲染双引号字符串字面量。
     */
    public static String quote(String value) {
        if (value.isEmpty()) {
            return EMPTY_STRING_LITERAL;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        appendEscaped(sb, value, false);
        sb.append('"');
        return sb.toString();
    }

    /**
     * 渲染 f-string 的原样文本部分：转义规则同 {@link #quote(String)}，另将花括号加倍。
     */
    public static String escapeTemplateText(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        appendEscaped(sb, value, true);
        return sb.toString();
    }

    /**
     * 该字符串渲染为字面量时是否需要反斜杠转义。
     */
    public static boolean needsEscape(String value) {
        return quote(value).indexOf('\\') >= 0;
    }

    /**
     * 将任意文本压成可安全放入三引号文档字符串的一行。
     */
    public static String docstringLine(String value) {
        String single = value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        return single.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static void appendEscaped(StringBuilder sb, String value, boolean doubleBraces) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '{':
                case '}':
                    sb.append(c);
                    if (doubleBraces) {
                        sb.append(c);
                    }
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
    }
}
