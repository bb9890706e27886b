package cn.hjw.dev.nodeflow.graph;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工作流中的一个节点实例
 */
@Getter
@ToString
public class WorkflowNode {

    private final String id;

    private final String typeId;

    private final Map<String, Object> config;

    public WorkflowNode(@NonNull String id, @NonNull String typeId, Map<String, Object> config) {
        this.id = id;
        this.typeId = typeId;
        this.config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
