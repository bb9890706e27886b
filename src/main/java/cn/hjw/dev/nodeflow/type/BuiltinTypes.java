package cn.hjw.dev.nodeflow.type;

import java.util.List;

/**
 * 内置数据类型
 */
public final class BuiltinTypes {

    public static final String STRING = "string";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";
    public static final String ADDRESS = "address";
    public static final String TOKEN = "token";
    public static final String TRANSACTION = "transaction";

    private BuiltinTypes() {
    }

    public static List<DataType> all() {
        return List.of(
                type(STRING, "Text", TypeCategory.PRIMITIVE, "Plain text string"),
                type(NUMBER, "Number", TypeCategory.PRIMITIVE, "Numeric value"),
                type(BOOLEAN, "Boolean", TypeCategory.PRIMITIVE, "True or false value"),
                type(OBJECT, "Object", TypeCategory.STRUCTURED, "JSON object with properties"),
                type(ARRAY, "Array", TypeCategory.STRUCTURED, "List of items"),
                type(ADDRESS, "Address", TypeCategory.BLOCKCHAIN, "Blockchain address"),
                type(TOKEN, "Token", TypeCategory.DEFI, "Token descriptor"),
                type(TRANSACTION, "Transaction", TypeCategory.BLOCKCHAIN, "Blockchain transaction")
        );
    }

    /**
     * 把内置类型注册到给定注册表
     */
    public static TypeRegistry registerAll(TypeRegistry registry) {
        all().forEach(registry::register);
        return registry;
    }

    private static DataType type(String id, String name, TypeCategory category, String description) {
        return DataType.builder()
                .id(id)
                .name(name)
                .category(category)
                .description(description)
                .build();
    }
}
