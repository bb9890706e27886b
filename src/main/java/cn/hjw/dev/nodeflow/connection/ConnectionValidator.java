package cn.hjw.dev.nodeflow.connection;

import cn.hjw.dev.nodeflow.transform.CompositeTransformer;
import cn.hjw.dev.nodeflow.transform.Transformer;
import cn.hjw.dev.nodeflow.transform.TransformerCatalog;
import cn.hjw.dev.nodeflow.type.DataType;
import cn.hjw.dev.nodeflow.type.TypeRegistry;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 连接校验器
 * 判断两个数据类型能否连线：
 * 1. 直接兼容 (同类型 / 声明兼容 / 内置静态规则)，成本 0，置信度 1.0
 * 2. 否则在转换器目录上做有界深度优先搜索，选出得分最高的路径并组合为单个转换器
 * 3. 无路径时拒绝，并给出可作为中间节点的类型建议
 * 结果按 (sourceType, targetType) 二元组缓存，条目过期后重新计算以感知新注册的转换器。
 * 计算是幂等且无副作用的，并发下重复计算不会破坏缓存。
 */
@Slf4j
public class ConnectionValidator {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(60);

    public static final int DEFAULT_MAX_HOPS = 3;

    private final TypeRegistry typeRegistry;
    private final TransformerCatalog catalog;
    private final StaticCompatibilityRules staticRules;
    private final Duration cacheTtl;
    private final int maxHops;
    private final Clock clock;

    private final Map<CacheKey, CachedResult> cache = new ConcurrentHashMap<>();

    public ConnectionValidator(TypeRegistry typeRegistry, TransformerCatalog catalog) {
        this(typeRegistry, catalog, StaticCompatibilityRules.defaults(), DEFAULT_CACHE_TTL, DEFAULT_MAX_HOPS, Clock.systemUTC());
    }

    public ConnectionValidator(TypeRegistry typeRegistry, TransformerCatalog catalog, StaticCompatibilityRules staticRules,
                               Duration cacheTtl, int maxHops, Clock clock) {
        if (maxHops < 1) {
            throw new IllegalArgumentException("maxHops must be at least 1, got " + maxHops);
        }
        this.typeRegistry = typeRegistry;
        this.catalog = catalog;
        this.staticRules = staticRules;
        this.cacheTtl = cacheTtl;
        this.maxHops = maxHops;
        this.clock = clock;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getMaxHops() {
        return maxHops;
    }

    /**
     * 校验 sourceType -> targetType 是否可连接
     */
    public ConnectionResult validate(String sourceType, String targetType) {
        CacheKey key = new CacheKey(sourceType, targetType);
        long now = clock.millis();
        CachedResult cached = cache.get(key);
        if (cached != null && cached.expiresAt > now) {
            log.debug("Connection cache hit for {} -> {}", sourceType, targetType);
            return cached.result;
        }
        ConnectionResult result = compute(sourceType, targetType);
        cache.put(key, new CachedResult(result, now + cacheTtl.toMillis()));
        return result;
    }

    /**
     * 端口级校验，诊断信息带上具体的连线描述
     */
    public ConnectionResult validatePorts(ConnectionAttempt attempt) {
        ConnectionResult result = validate(attempt.getSourceDataType(), attempt.getTargetDataType());
        if (result.getErrors().isEmpty() && result.getWarnings().isEmpty()) {
            return result;
        }
        String prefix = attempt.describe() + ": ";
        return result.toBuilder()
                .clearErrors()
                .errors(result.getErrors().stream().map(prefix::concat).collect(Collectors.toList()))
                .clearWarnings()
                .warnings(result.getWarnings().stream().map(prefix::concat).collect(Collectors.toList()))
                .build();
    }

    public boolean canConnect(String sourceType, String targetType) {
        return validate(sourceType, targetType).canConnect();
    }

    /**
     * 与 sourceType 直接兼容的全部已注册类型 (不含自身)
     */
    public List<String> compatibleTargetTypes(String sourceType) {
        Optional<DataType> source = typeRegistry.find(sourceType);
        if (source.isEmpty()) {
            return List.of();
        }
        return typeRegistry.all().stream()
                .filter(candidate -> !candidate.getId().equals(sourceType))
                .filter(candidate -> isDirectlyCompatible(source.get(), candidate))
                .map(DataType::getId)
                .collect(Collectors.toList());
    }

    public void clearCache() {
        cache.clear();
    }

    public int cacheSize() {
        return cache.size();
    }

    private ConnectionResult compute(String sourceTypeId, String targetTypeId) {
        Optional<DataType> sourceType = typeRegistry.find(sourceTypeId);
        if (sourceType.isEmpty()) {
            return ConnectionResult.rejected(ConnectionErrorCode.UNKNOWN_SOURCE_TYPE,
                    "Unknown source data type: " + sourceTypeId);
        }
        Optional<DataType> targetType = typeRegistry.find(targetTypeId);
        if (targetType.isEmpty()) {
            return ConnectionResult.rejected(ConnectionErrorCode.UNKNOWN_TARGET_TYPE,
                    "Unknown target data type: " + targetTypeId);
        }
        DataType source = sourceType.get();
        DataType target = targetType.get();

        if (isDirectlyCompatible(source, target)) {
            ConnectionResult.ConnectionResultBuilder direct = ConnectionResult.builder()
                    .canConnect(true)
                    .path(CompatibilityPath.direct())
                    .cost(0)
                    .confidence(1.0)
                    .warnings(deprecationWarnings(source, target));
            if (!declaredCompatible(source, target)) {
                staticRules.coercion(source.getId(), target.getId()).ifPresent(direct::transformer);
            }
            return direct.build();
        }

        List<CompatibilityPath> paths = findPaths(source.getId(), target.getId());
        if (paths.isEmpty()) {
            log.debug("No transformation path from {} to {} within {} hops", source.getId(), target.getId(), maxHops);
            return ConnectionResult.rejected(ConnectionErrorCode.NO_TRANSFORMATION_PATH,
                            "No transformation path found from " + source.getId() + " to " + target.getId())
                    .toBuilder()
                    .suggestions(suggestions(source, target))
                    .build();
        }

        CompatibilityPath best = paths.stream().min(CompatibilityPath.PREFERENCE).orElseThrow();
        Transformer transformer = CompositeTransformer.of(best.transformers());
        log.debug("Resolved {} -> {} via {} ({} candidate paths)", source.getId(), target.getId(), best, paths.size());

        List<String> warnings = new ArrayList<>(deprecationWarnings(source, target));
        if (best.getHopCount() > 2) {
            warnings.add("This connection requires " + best.getHopCount() + " transformation steps (" + best.describe() + ")");
        }
        if (best.isLossy()) {
            warnings.add("This transformation may lose data precision");
        }
        if (best.hasAsynchronousStep()) {
            warnings.add("This connection involves asynchronous transformations and may add latency");
        }
        return ConnectionResult.builder()
                .canConnect(true)
                .transformer(transformer)
                .path(best)
                .cost(best.getTotalCost())
                .confidence(best.confidence())
                .warnings(warnings)
                .build();
    }

    public boolean isDirectlyCompatible(DataType source, DataType target) {
        return declaredCompatible(source, target) || staticRules.matches(source.getId(), target.getId());
    }

    private boolean declaredCompatible(DataType source, DataType target) {
        return source.getId().equals(target.getId())
                || source.declaresCompatibilityWith(target.getId())
                || target.declaresCompatibilityWith(source.getId());
    }

    /**
     * 有界 DFS，同一路径内不重复访问类型，不同路径之间可复用
     */
    private List<CompatibilityPath> findPaths(String sourceTypeId, String targetTypeId) {
        List<CompatibilityPath> found = new ArrayList<>();
        search(sourceTypeId, targetTypeId, new ArrayList<>(), new HashSet<>(), found);
        return found;
    }

    private void search(String current, String targetTypeId, List<ValidationStep> path,
                        Set<String> visited, List<CompatibilityPath> found) {
        if (current.equals(targetTypeId)) {
            found.add(new CompatibilityPath(path));
            return;
        }
        if (path.size() >= maxHops) {
            return;
        }
        visited.add(current);
        for (Transformer transformer : catalog.from(current)) {
            String next = transformer.getToType();
            if (visited.contains(next)) {
                continue;
            }
            path.add(new ValidationStep(current, next, transformer));
            search(next, targetTypeId, path, visited, found);
            path.remove(path.size() - 1);
        }
        visited.remove(current);
    }

    private List<String> suggestions(DataType source, DataType target) {
        List<DataType> others = typeRegistry.all().stream()
                .filter(type -> !type.getId().equals(source.getId()) && !type.getId().equals(target.getId()))
                .collect(Collectors.toList());

        List<String> intermediates = others.stream()
                .filter(type -> isDirectlyCompatible(source, type) && isDirectlyCompatible(type, target))
                .map(DataType::getDisplayName)
                .collect(Collectors.toList());
        List<String> fromSource = others.stream()
                .filter(type -> isDirectlyCompatible(source, type))
                .map(DataType::getDisplayName)
                .collect(Collectors.toList());
        List<String> intoTarget = others.stream()
                .filter(type -> isDirectlyCompatible(type, target))
                .map(DataType::getDisplayName)
                .collect(Collectors.toList());

        List<String> suggestions = new ArrayList<>();
        if (!intermediates.isEmpty()) {
            suggestions.add("Consider an intermediate conversion through: " + String.join(", ", intermediates));
        }
        if (!fromSource.isEmpty()) {
            suggestions.add(source.getDisplayName() + " connects directly to: " + String.join(", ", fromSource));
        }
        if (!intoTarget.isEmpty()) {
            suggestions.add(target.getDisplayName() + " accepts directly: " + String.join(", ", intoTarget));
        }
        return suggestions;
    }

    private List<String> deprecationWarnings(DataType source, DataType target) {
        List<String> warnings = new ArrayList<>();
        if (typeRegistry.isDeprecated(source.getId())) {
            warnings.add("Data type [" + source.getId() + "] is deprecated");
        }
        if (!target.getId().equals(source.getId()) && typeRegistry.isDeprecated(target.getId())) {
            warnings.add("Data type [" + target.getId() + "] is deprecated");
        }
        return warnings;
    }

    // 类型ID是任意字符串，不能拼接成单个字符串作为键
    @EqualsAndHashCode
    @RequiredArgsConstructor
    private static class CacheKey {
        private final String sourceType;
        private final String targetType;
    }

    @RequiredArgsConstructor
    private static class CachedResult {
        private final ConnectionResult result;
        private final long expiresAt;
    }
}
