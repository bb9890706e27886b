package cn.hjw.dev.nodeflow.component;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存 Map 的组件目录
 */
@Slf4j
public class InMemoryComponentDirectory implements ComponentDirectory {

    private final Map<String, ComponentDescriptor> descriptors = new ConcurrentHashMap<>();

    public InMemoryComponentDirectory register(ComponentDescriptor descriptor) {
        if (descriptors.putIfAbsent(descriptor.getTypeId(), descriptor) != null) {
            throw new IllegalArgumentException("Component type [" + descriptor.getTypeId() + "] is already registered");
        }
        log.debug("Registered component [{}]", descriptor.getTypeId());
        return this;
    }

    @Override
    public Optional<ComponentDescriptor> getDescriptor(String typeId) {
        return typeId == null ? Optional.empty() : Optional.ofNullable(descriptors.get(typeId));
    }
}
