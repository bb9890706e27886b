package cn.hjw.dev.nodeflow.type;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 类型注册表
 * 只增不删：注册发生在工作流运行之前，运行期间只读，支持并发读取
 */
@Slf4j
public class TypeRegistry {

    private final Map<String, DataType> types = new ConcurrentHashMap<>();

    // 保留注册顺序，保证建议列表等输出稳定
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    private final Set<String> deprecated = ConcurrentHashMap.newKeySet();

    /**
     * 注册数据类型
     * @throws IllegalArgumentException 类型ID已存在
     */
    public TypeRegistry register(DataType type) {
        DataType existing = types.putIfAbsent(type.getId(), type);
        if (existing != null) {
            throw new IllegalArgumentException("Data type [" + type.getId() + "] is already registered");
        }
        registrationOrder.add(type.getId());
        log.debug("Registered data type [{}] ({})", type.getId(), type.getCategory());
        return this;
    }

    public Optional<DataType> find(String typeId) {
        return typeId == null ? Optional.empty() : Optional.ofNullable(types.get(typeId));
    }

    public boolean contains(String typeId) {
        return typeId != null && types.containsKey(typeId);
    }

    /**
     * 按注册顺序返回全部类型
     */
    public List<DataType> all() {
        return registrationOrder.stream().map(types::get).collect(Collectors.toList());
    }

    /**
     * 标记类型为废弃，历史工作流仍可引用
     */
    public void deprecate(String typeId) {
        if (!contains(typeId)) {
            throw new IllegalArgumentException("Unknown data type [" + typeId + "]");
        }
        if (deprecated.add(typeId)) {
            log.info("Data type [{}] marked as deprecated", typeId);
        }
    }

    public boolean isDeprecated(String typeId) {
        return deprecated.contains(typeId);
    }

    public int size() {
        return types.size();
    }
}
