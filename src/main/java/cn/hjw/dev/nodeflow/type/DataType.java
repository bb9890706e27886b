package cn.hjw.dev.nodeflow.type;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 数据类型定义
 * 注册后不可变; 废弃的类型只打标记 (见 {@link TypeRegistry#deprecate(String)})，从不删除
 */
@Getter
@Builder
@ToString(of = {"id", "category"})
public class DataType {

    @NonNull
    private final String id;

    private final String name;

    @Builder.Default
    private final TypeCategory category = TypeCategory.PRIMITIVE;

    private final String description;

    // 静态声明的兼容类型ID
    @Singular("compatibleType")
    private final List<String> compatibleWith;

    /**
     * 展示名，未配置时退化为 id
     */
    public String getDisplayName() {
        return name != null ? name : id;
    }

    public boolean declaresCompatibilityWith(String typeId) {
        return compatibleWith.contains(typeId);
    }
}
