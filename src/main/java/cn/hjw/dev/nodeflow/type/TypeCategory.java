package cn.hjw.dev.nodeflow.type;

/**
 * 数据类型分类
 */
public enum TypeCategory {
    PRIMITIVE,
    STRUCTURED,
    BLOCKCHAIN,
    DEFI,
    FILE,
    STREAMING,
    COMPUTED,
    EXTERNAL
}
