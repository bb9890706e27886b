package cn.hjw.dev.nodeflow.transform;

/**
 * 值转换函数
 */
@FunctionalInterface
public interface TransformFunction {

    /**
     * 转换一个值
     * @param value 源类型的值
     * @return 目标类型的值
     * @throws Exception 无法转换
     */
    Object apply(Object value) throws Exception;
}
