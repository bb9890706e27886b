package cn.hjw.dev.nodeflow.connection;

import cn.hjw.dev.nodeflow.transform.BuiltinTransformers;
import cn.hjw.dev.nodeflow.transform.TransformFunction;
import cn.hjw.dev.nodeflow.transform.Transformer;
import cn.hjw.dev.nodeflow.type.BuiltinTypes;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内置的静态兼容规则 (零成本直连)
 * 运行时表示需要改变的规则附带一个零成本的强制转换
 */
public class StaticCompatibilityRules {

    private static final Object NO_COERCION = new Object();

    private final Map<String, Map<String, Object>> rules = new ConcurrentHashMap<>();

    public static StaticCompatibilityRules none() {
        return new StaticCompatibilityRules();
    }

    public static StaticCompatibilityRules defaults() {
        return new StaticCompatibilityRules()
                .allow(BuiltinTypes.NUMBER, BuiltinTypes.STRING, BuiltinTransformers::numberToText)
                .allow(BuiltinTypes.BOOLEAN, BuiltinTypes.STRING, String::valueOf)
                .allow(BuiltinTypes.BOOLEAN, BuiltinTypes.NUMBER, value -> Boolean.TRUE.equals(value) ? 1 : 0)
                .allow(BuiltinTypes.OBJECT, BuiltinTypes.STRING, BuiltinTransformers::toJson)
                .allow(BuiltinTypes.ARRAY, BuiltinTypes.STRING, BuiltinTransformers::toJson)
                .allow(BuiltinTypes.ADDRESS, BuiltinTypes.STRING)
                .allow(BuiltinTypes.TOKEN, BuiltinTypes.OBJECT)
                .allow(BuiltinTypes.TRANSACTION, BuiltinTypes.OBJECT);
    }

    /**
     * 值原样传递的直连规则
     */
    public StaticCompatibilityRules allow(String fromType, String toType) {
        rules.computeIfAbsent(fromType, k -> new ConcurrentHashMap<>()).put(toType, NO_COERCION);
        return this;
    }

    public StaticCompatibilityRules allow(String fromType, String toType, TransformFunction coercion) {
        Transformer transformer = Transformer.builder()
                .id("builtin:" + fromType + "->" + toType)
                .name("Coerce " + fromType + " to " + toType)
                .fromType(fromType)
                .toType(toType)
                .cost(0)
                .function(coercion)
                .build();
        rules.computeIfAbsent(fromType, k -> new ConcurrentHashMap<>()).put(toType, transformer);
        return this;
    }

    public boolean matches(String fromType, String toType) {
        Map<String, Object> targets = rules.get(fromType);
        return targets != null && targets.containsKey(toType);
    }

    public Optional<Transformer> coercion(String fromType, String toType) {
        Map<String, Object> targets = rules.get(fromType);
        if (targets == null) {
            return Optional.empty();
        }
        Object rule = targets.get(toType);
        return rule instanceof Transformer ? Optional.of((Transformer) rule) : Optional.empty();
    }
}
