package cn.hjw.dev.nodeflow.component;

import java.util.Optional;

/**
 * 组件目录 (外部协作方)
 * 编排器只通过它查询组件描述，从不修改目录状态
 */
@FunctionalInterface
public interface ComponentDirectory {

    /**
     * 按节点类型查询组件描述
     * @param typeId 节点类型
     * @return 未找到时为空
     */
    Optional<ComponentDescriptor> getDescriptor(String typeId);
}
