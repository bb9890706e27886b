package cn.hjw.dev.nodeflow.compile;

import cn.hjw.dev.nodeflow.component.ComponentDescriptor;
import cn.hjw.dev.nodeflow.component.ComponentDirectory;
import cn.hjw.dev.nodeflow.component.ConfigField;
import cn.hjw.dev.nodeflow.exception.ValidationError;
import cn.hjw.dev.nodeflow.exception.ValidationErrorCode;
import cn.hjw.dev.nodeflow.exception.WorkflowValidationException;
import cn.hjw.dev.nodeflow.graph.WorkflowEdge;
import cn.hjw.dev.nodeflow.graph.WorkflowGraph;
import cn.hjw.dev.nodeflow.graph.WorkflowNode;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.ExecutionState;
import cn.hjw.dev.nodeflow.report.TerminationReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 图构建器
 * 校验节点类型与连线，并用 Kahn 算法计算拓扑序。
 * 同层节点按声明顺序出队，同一张图多次构建得到相同的顺序。
 */
@Slf4j
@RequiredArgsConstructor
public class GraphBuilder {

    private final ComponentDirectory directory;

    /**
     * 编译工作流为执行计划
     * @param workflow 工作流定义
     * @return 执行计划
     * @throws WorkflowValidationException 未知节点类型、缺少必填配置、悬空连线、未知端口或存在环
     */
    public ExecutionPlan build(WorkflowGraph workflow) {
        List<ValidationError> errors = new ArrayList<>();

        // 1. 节点校验
        Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        Map<String, ComponentDescriptor> descriptors = new HashMap<>();
        for (WorkflowNode node : workflow.getNodes()) {
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                errors.add(new ValidationError(ValidationErrorCode.DUPLICATE_NODE_ID,
                        "Duplicate node id [" + node.getId() + "]", List.of(node.getId())));
                continue;
            }
            Optional<ComponentDescriptor> descriptor = directory.getDescriptor(node.getTypeId());
            if (descriptor.isPresent()) {
                descriptors.put(node.getId(), descriptor.get());
                validateConfig(node, descriptor.get(), errors);
            } else {
                errors.add(new ValidationError(ValidationErrorCode.UNKNOWN_NODE_TYPE,
                        "Node [" + node.getId() + "] has unknown type [" + node.getTypeId() + "]", List.of(node.getId())));
            }
        }

        // 2. 连线校验 & 构建反向依赖表 (Child -> Parents)
        Map<String, List<WorkflowEdge>> inboundEdges = new HashMap<>();
        Map<String, List<String>> nodeParentsMap = new HashMap<>();
        Map<String, List<String>> routeTable = new HashMap<>(); // Parent -> Children
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        nodes.keySet().forEach(id -> {
            inboundEdges.put(id, new ArrayList<>());
            nodeParentsMap.put(id, new ArrayList<>());
            routeTable.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        });

        Set<String> boundInputs = new HashSet<>();
        for (WorkflowEdge edge : workflow.getEdges()) {
            if (!validateEdge(edge, nodes, descriptors, errors)) {
                continue;
            }
            if (!boundInputs.add(edge.getTargetNodeId() + "." + edge.getTargetPort())) {
                errors.add(new ValidationError(ValidationErrorCode.DUPLICATE_INPUT_BINDING,
                        "Input port " + edge.getTargetNodeId() + "." + edge.getTargetPort() + " has more than one inbound edge",
                        List.of(edge.getTargetNodeId())));
                continue;
            }
            String parent = edge.getSourceNodeId();
            String child = edge.getTargetNodeId();
            inboundEdges.get(child).add(edge);
            if (!nodeParentsMap.get(child).contains(parent)) {
                nodeParentsMap.get(child).add(parent);
                routeTable.get(parent).add(child);
                inDegree.merge(child, 1, Integer::sum);
            }
        }

        // 3. 拓扑排序 (Kahn)
        List<String> order = new ArrayList<>();
        Map<String, Integer> remaining = new LinkedHashMap<>(inDegree);
        Queue<String> queue = new ArrayDeque<>();
        remaining.forEach((k, v) -> {
            if (v == 0) queue.offer(k);
        });

        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (String child : routeTable.get(node)) {
                int degree = remaining.merge(child, -1, Integer::sum);
                if (degree == 0) {
                    queue.offer(child);
                }
            }
        }

        if (order.size() != nodes.size()) {
            List<String> cyclic = cyclicNodes(nodes.keySet(), order, routeTable);
            errors.add(new ValidationError(ValidationErrorCode.CYCLE_DETECTED,
                    "DAG cycle detected among nodes " + cyclic, cyclic));
        }

        if (!errors.isEmpty()) {
            log.warn("Workflow [{}] failed validation with {} error(s): {}", workflow.getId(), errors.size(), errors);
            throw new WorkflowValidationException(errors, validationFailureReport(workflow, errors));
        }

        log.debug("Workflow [{}] compiled, execution order {}", workflow.getId(), order);
        return new ExecutionPlan(
                workflow.getId(),
                List.copyOf(order),
                Collections.unmodifiableMap(nodes),
                Collections.unmodifiableMap(descriptors),
                freeze(inboundEdges),
                freeze(nodeParentsMap)
        );
    }

    private void validateConfig(WorkflowNode node, ComponentDescriptor descriptor, List<ValidationError> errors) {
        for (ConfigField field : descriptor.requiredConfigFields()) {
            if (node.getConfig().get(field.getKey()) == null) {
                errors.add(new ValidationError(ValidationErrorCode.MISSING_CONFIG,
                        "Node [" + node.getId() + "] is missing required configuration [" + field.getDisplayName() + "]",
                        List.of(node.getId())));
            }
        }
    }

    private boolean validateEdge(WorkflowEdge edge, Map<String, WorkflowNode> nodes,
                                 Map<String, ComponentDescriptor> descriptors, List<ValidationError> errors) {
        boolean valid = true;
        for (String nodeId : List.of(edge.getSourceNodeId(), edge.getTargetNodeId())) {
            if (!nodes.containsKey(nodeId)) {
                errors.add(new ValidationError(ValidationErrorCode.DANGLING_EDGE,
                        "Edge " + edge + " references unknown node [" + nodeId + "]", List.of(nodeId)));
                valid = false;
            }
        }
        if (!valid) {
            return false;
        }
        ComponentDescriptor source = descriptors.get(edge.getSourceNodeId());
        if (source != null && source.findOutput(edge.getSourcePort()).isEmpty()) {
            errors.add(new ValidationError(ValidationErrorCode.UNKNOWN_PORT,
                    "Edge " + edge + " references unknown output port [" + edge.getSourcePort() + "] of type ["
                            + source.getTypeId() + "]", List.of(edge.getSourceNodeId())));
            valid = false;
        }
        ComponentDescriptor target = descriptors.get(edge.getTargetNodeId());
        if (target != null && target.findInput(edge.getTargetPort()).isEmpty()) {
            errors.add(new ValidationError(ValidationErrorCode.UNKNOWN_PORT,
                    "Edge " + edge + " references unknown input port [" + edge.getTargetPort() + "] of type ["
                            + target.getTypeId() + "]", List.of(edge.getTargetNodeId())));
            valid = false;
        }
        // 类型未知的节点已单独报错，其连线仍参与环检测
        return valid;
    }

    /**
     * 未排序的剩余节点中，反复剥离没有剩余后继的节点，剩下的就是环上 (或环之间) 的节点
     */
    private List<String> cyclicNodes(Set<String> all, List<String> ordered, Map<String, List<String>> routeTable) {
        Set<String> ordersSet = new HashSet<>(ordered);
        Set<String> rest = all.stream().filter(id -> !ordersSet.contains(id))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        boolean changed = true;
        while (changed) {
            changed = rest.removeIf(id -> routeTable.get(id).stream().noneMatch(rest::contains));
        }
        return new ArrayList<>(rest);
    }

    private ExecutionReport validationFailureReport(WorkflowGraph workflow, List<ValidationError> errors) {
        return ExecutionReport.builder()
                .executionId("validation-" + UUID.randomUUID())
                .workflowId(workflow.getId())
                .state(ExecutionState.FAILED)
                .reason(TerminationReason.VALIDATION)
                .success(false)
                .perNode(List.of())
                .errors(errors.stream().map(ValidationError::toString).collect(Collectors.toList()))
                .build();
    }

    private static <V> Map<String, List<V>> freeze(Map<String, List<V>> source) {
        Map<String, List<V>> frozen = new HashMap<>();
        source.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
