package cn.hjw.dev.nodeflow.exception;

import cn.hjw.dev.nodeflow.report.ExecutionReport;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流校验失败 (未知节点类型、悬空连线、环等)，没有任何节点被执行
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    // 失败状态的报告，perNode 为空列表
    private final ExecutionReport report;

    public WorkflowValidationException(List<ValidationError> errors, ExecutionReport report) {
        super("Workflow validation failed: " + errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
        this.report = report;
    }

    public boolean hasError(ValidationErrorCode code) {
        return errors.stream().anyMatch(e -> e.getCode() == code);
    }
}
