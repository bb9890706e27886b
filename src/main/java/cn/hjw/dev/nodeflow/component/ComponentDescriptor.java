package cn.hjw.dev.nodeflow.component;

import cn.hjw.dev.nodeflow.processor.NodeExecutor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 组件描述：端口列表 + 配置项声明 + 不透明的执行器
 * 由组件目录持有，编排器只读使用
 */
@Getter
@Builder
@ToString(of = {"typeId", "inputPorts", "outputPorts"})
public class ComponentDescriptor {

    @NonNull
    private final String typeId;

    @Singular
    private final List<InputPort> inputPorts;

    @Singular
    private final List<OutputPort> outputPorts;

    // 配置项 (节点 config 的键)
    @Singular
    private final List<ConfigField> configFields;

    @NonNull
    private final NodeExecutor executor;

    // 组件自带的超时 (毫秒)，优先于执行选项
    private final Long timeoutMs;

    public Optional<InputPort> findInput(String portId) {
        return inputPorts.stream().filter(p -> p.getId().equals(portId)).findFirst();
    }

    public List<ConfigField> requiredConfigFields() {
        return configFields.stream().filter(ConfigField::isRequired).collect(Collectors.toList());
    }

    public Optional<OutputPort> findOutput(String portId) {
        return outputPorts.stream().filter(p -> p.getId().equals(portId)).findFirst();
    }
}
