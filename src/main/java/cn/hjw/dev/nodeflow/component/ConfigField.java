package cn.hjw.dev.nodeflow.component;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 组件配置项声明
 * 必填项在工作流校验阶段检查，缺失时不执行任何节点
 */
@Getter
@Builder
@ToString
public class ConfigField {

    @NonNull
    private final String key;

    private final String name;

    private final boolean required;

    public static ConfigField required(String key) {
        return ConfigField.builder().key(key).required(true).build();
    }

    public static ConfigField optional(String key) {
        return ConfigField.builder().key(key).build();
    }

    public String getDisplayName() {
        return name != null ? name : key;
    }
}
