package cn.hjw.dev.nodeflow.transform;

import cn.hjw.dev.nodeflow.type.TypeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 转换器目录
 * 维护 fromType -> [transformer] 邻接表，供连接校验做多跳搜索
 */
@Slf4j
public class TransformerCatalog {

    private final TypeRegistry typeRegistry;

    private final Map<String, List<Transformer>> adjacency = new ConcurrentHashMap<>();

    private final Map<String, Transformer> byId = new ConcurrentHashMap<>();

    public TransformerCatalog(TypeRegistry typeRegistry) {
        this.typeRegistry = typeRegistry;
    }

    /**
     * 注册转换器
     * @throws IllegalArgumentException 成本为负、自环、类型未注册或ID重复
     */
    public TransformerCatalog register(Transformer transformer) {
        String id = transformer.getId();
        if (!(transformer.getCost() >= 0)) {
            throw new IllegalArgumentException("Transformer [" + id + "] has negative cost " + transformer.getCost());
        }
        if (transformer.getFromType().equals(transformer.getToType())) {
            throw new IllegalArgumentException("Transformer [" + id + "] is a self-loop on " + transformer.getFromType());
        }
        if (!typeRegistry.contains(transformer.getFromType())) {
            throw new IllegalArgumentException("Transformer [" + id + "] source type [" + transformer.getFromType() + "] is not registered");
        }
        if (!typeRegistry.contains(transformer.getToType())) {
            throw new IllegalArgumentException("Transformer [" + id + "] target type [" + transformer.getToType() + "] is not registered");
        }
        if (byId.putIfAbsent(id, transformer) != null) {
            throw new IllegalArgumentException("Transformer [" + id + "] is already registered");
        }
        adjacency.computeIfAbsent(transformer.getFromType(), k -> new CopyOnWriteArrayList<>()).add(transformer);
        log.debug("Registered transformer [{}] {} -> {} (cost={}, lossy={})",
                id, transformer.getFromType(), transformer.getToType(), transformer.getCost(), transformer.isLossy());
        return this;
    }

    /**
     * 以 fromType 为起点的全部转换器，按注册顺序
     */
    public List<Transformer> from(String fromType) {
        List<Transformer> list = adjacency.get(fromType);
        return list == null ? List.of() : List.copyOf(list);
    }

    public Optional<Transformer> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return byId.size();
    }
}
