package cn.hjw.dev.nodeflow.transform;

import cn.hjw.dev.nodeflow.type.BuiltinTypes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置转换器 (JSON 解析/序列化、数字与文本互转)
 * 需要显式安装到目录中，不会自动注册
 */
public final class BuiltinTransformers {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private BuiltinTransformers() {
    }

    public static List<Transformer> all() {
        return List.of(
                Transformer.builder().id("string_to_json").name("Parse JSON")
                        .fromType(BuiltinTypes.STRING).toType(BuiltinTypes.OBJECT).cost(2)
                        .function(value -> MAPPER.readValue(text(value), new TypeReference<Map<String, Object>>() { }))
                        .build(),
                Transformer.builder().id("string_to_json_array").name("Parse JSON array")
                        .fromType(BuiltinTypes.STRING).toType(BuiltinTypes.ARRAY).cost(2)
                        .function(value -> MAPPER.readValue(text(value), new TypeReference<List<Object>>() { }))
                        .build(),
                Transformer.builder().id("object_to_string").name("Stringify JSON")
                        .fromType(BuiltinTypes.OBJECT).toType(BuiltinTypes.STRING)
                        .function(BuiltinTransformers::toJson)
                        .build(),
                Transformer.builder().id("array_to_string").name("Stringify JSON array")
                        .fromType(BuiltinTypes.ARRAY).toType(BuiltinTypes.STRING)
                        .function(BuiltinTransformers::toJson)
                        .build(),
                Transformer.builder().id("number_to_string").name("Number to String")
                        .fromType(BuiltinTypes.NUMBER).toType(BuiltinTypes.STRING)
                        .function(BuiltinTransformers::numberToText)
                        .build(),
                Transformer.builder().id("string_to_number").name("String to Number")
                        .fromType(BuiltinTypes.STRING).toType(BuiltinTypes.NUMBER)
                        .function(value -> Double.parseDouble(text(value).trim()))
                        .build(),
                Transformer.builder().id("boolean_to_string").name("Boolean to String")
                        .fromType(BuiltinTypes.BOOLEAN).toType(BuiltinTypes.STRING)
                        .function(String::valueOf)
                        .build(),
                Transformer.builder().id("token_to_object").name("Token to Object")
                        .fromType(BuiltinTypes.TOKEN).toType(BuiltinTypes.OBJECT)
                        .function(BuiltinTransformers::shallowCopy)
                        .build()
        );
    }

    /**
     * 安装全部内置转换器，要求内置类型已注册
     */
    public static TransformerCatalog registerAll(TransformerCatalog catalog) {
        all().forEach(catalog::register);
        return catalog;
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * 整数值不带小数部分输出，例如 42.0 -> "42"
     */
    public static String numberToText(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d)) {
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
        }
        return String.valueOf(value);
    }

    private static String text(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value is null");
        }
        return value.toString();
    }

    private static Object shallowCopy(Object value) {
        if (value instanceof Map) {
            return new LinkedHashMap<>((Map<?, ?>) value);
        }
        throw new IllegalArgumentException("expected a map but got " + (value == null ? "null" : value.getClass().getName()));
    }
}
