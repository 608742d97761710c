package xyz.vvrf.graph.codegen.codegen;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.exception.CompositePayloadSerializationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 复合节点配置与不透明文本载荷之间的编解码。
 * 载荷是按键排序的 JSON 的 Base64 编码，按固定宽度折行后放入三引号字符串常量，
 * 只含 Base64 字符，因此不会出现任何容器字面量。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CompositePayloadCodec {

    public static final String PAYLOAD_CONSTANT = "COMPOSITE_CONFIG";
    public static final int LINE_WIDTH = 76;
    private static final String TRIPLE_QUOTE = "\"\"\"";
    private static final String UNKNOWN_NAME = "<payload>";
    private static final Pattern PAYLOAD_ASSIGNMENT = Pattern.compile(PAYLOAD_CONSTANT + "\\s*=\\s*\"\"\"");

    private final ObjectMapper mapper;

    public CompositePayloadCodec() {
        this(new ObjectMapper());
    }

    public CompositePayloadCodec(ObjectMapper baseMapper) {
        this.mapper = Objects.requireNonNull(baseMapper, "ObjectMapper 不能为空").copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * @return 未折行的 Base64 载荷
     * @throws CompositePayloadSerializationException 无法序列化时
     */
    public String encode(CompositeConfig config) {
        try {
            byte[] json = mapper.writeValueAsBytes(config);
            return Base64.getEncoder().encodeToString(json);
        } catch (IOException e) {
            throw new CompositePayloadSerializationException(config.getNodeName(), "复合节点配置无法序列化: " + e.getMessage(), e);
        }
    }

    /**
     * 按 {@link #LINE_WIDTH} 折行的载荷。
     */
    public List<String> encodeLines(CompositeConfig config) {
        String payload = encode(config);
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < payload.length(); i += LINE_WIDTH) {
            lines.add(payload.substring(i, Math.min(payload.length(), i + LINE_WIDTH)));
        }
        return lines;
    }

    /**
     * 解析载荷。既接受裸载荷，也接受包含 {@link #PAYLOAD_CONSTANT} 常量的完整生成源码。
     *
     * @throws CompositePayloadSerializationException 无法解析时
     */
    public CompositeConfig decode(String text) {
        Objects.requireNonNull(text, "载荷不能为空");
        String payload = extractPayload(text);
        byte[] json;
        try {
            json = Base64.getDecoder().decode(payload.replaceAll("\\s+", ""));
        } catch (IllegalArgumentException e) {
            throw new CompositePayloadSerializationException(UNKNOWN_NAME, "载荷不是合法的 Base64 文本", e);
        }
        try {
            return mapper.readValue(json, CompositeConfig.class);
        } catch (IOException e) {
            log.debug("载荷 JSON: {}", new String(json, StandardCharsets.UTF_8));
            throw new CompositePayloadSerializationException(UNKNOWN_NAME, "载荷无法解析为复合节点配置: " + e.getMessage(), e);
        }
    }

    public boolean equivalent(CompositeConfig a, CompositeConfig b) {
        return CompositeConfigEquivalence.equivalent(mapper, a, b);
    }

    private static String extractPayload(String text) {
        if (!text.contains(PAYLOAD_CONSTANT)) {
            return text;
        }
        Matcher matcher = PAYLOAD_ASSIGNMENT.matcher(text);
        if (!matcher.find()) {
            throw new CompositePayloadSerializationException(UNKNOWN_NAME, "找不到 " + PAYLOAD_CONSTANT + " 的三引号字符串");
        }
        int close = text.indexOf(TRIPLE_QUOTE, matcher.end());
        if (close < 0) {
            throw new CompositePayloadSerializationException(UNKNOWN_NAME, PAYLOAD_CONSTANT + " 的三引号字符串未闭合");
        }
        return text.substring(matcher.end(), close);
    }
}
