package cn.hjw.dev.nodeflow.transform;

import cn.hjw.dev.nodeflow.type.BuiltinTypes;
import cn.hjw.dev.nodeflow.type.TypeRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

public class TransformerCatalogTest {

    private TransformerCatalog catalog;

    @BeforeEach
    public void setUp() {
        catalog = new TransformerCatalog(BuiltinTypes.registerAll(new TypeRegistry()));
    }

    @Test
    public void testRegisterKeepsOrderPerSourceType() {
        catalog.register(transformer("a", BuiltinTypes.STRING, BuiltinTypes.NUMBER, 1));
        catalog.register(transformer("b", BuiltinTypes.STRING, BuiltinTypes.OBJECT, 2));
        catalog.register(transformer("c", BuiltinTypes.NUMBER, BuiltinTypes.STRING, 1));

        List<String> fromString = catalog.from(BuiltinTypes.STRING).stream().map(Transformer::getId).collect(Collectors.toList());
        Assertions.assertEquals(List.of("a", "b"), fromString);
        Assertions.assertTrue(catalog.from(BuiltinTypes.ARRAY).isEmpty());
        Assertions.assertEquals(3, catalog.size());
        Assertions.assertTrue(catalog.find("c").isPresent());
    }

    @Test
    public void testNegativeCostRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> catalog.register(transformer("neg", BuiltinTypes.STRING, BuiltinTypes.NUMBER, -1)));
        Assertions.assertEquals(0, catalog.size());
    }

    @Test
    public void testSelfLoopRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> catalog.register(transformer("loop", BuiltinTypes.STRING, BuiltinTypes.STRING, 0)));
    }

    @Test
    public void testUnknownTypesRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> catalog.register(transformer("x", "wei", BuiltinTypes.NUMBER, 1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> catalog.register(transformer("y", BuiltinTypes.NUMBER, "wei", 1)));
    }

    @Test
    public void testDuplicateIdRejected() {
        catalog.register(transformer("dup", BuiltinTypes.STRING, BuiltinTypes.NUMBER, 1));

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> catalog.register(transformer("dup", BuiltinTypes.NUMBER, BuiltinTypes.STRING, 1)));
        Assertions.assertEquals(1, catalog.from(BuiltinTypes.STRING).size());
        Assertions.assertTrue(catalog.from(BuiltinTypes.NUMBER).isEmpty());
    }

    /**
     * 组合转换器按顺序执行，任一步失败即短路并指出失败的步骤
     */
    @Test
    public void testCompositeShortCircuitsOnFailure() {
        AtomicBoolean secondCalled = new AtomicBoolean(false);
        Transformer first = Transformer.builder().id("first").fromType("string").toType("object").cost(2)
                .function(value -> {
                    throw new IllegalArgumentException("not json");
                })
                .build();
        Transformer second = Transformer.builder().id("second").fromType("object").toType("array").cost(1)
                .function(value -> {
                    secondCalled.set(true);
                    return List.of(value);
                })
                .build();

        Transformer composite = CompositeTransformer.of(List.of(first, second));

        Assertions.assertEquals(3.0, composite.getCost());
        Assertions.assertEquals("string", composite.getFromType());
        Assertions.assertEquals("array", composite.getToType());
        TransformationException ex = Assertions.assertThrows(TransformationException.class, () -> composite.apply("{"));
        Assertions.assertTrue(ex.getMessage().contains("Step 1/2"));
        Assertions.assertEquals(composite.getId(), ex.getTransformerId());
        Assertions.assertFalse(secondCalled.get());
    }

    @Test
    public void testCompositeOfSingleStepIsThatStep() {
        Transformer only = transformer("only", BuiltinTypes.STRING, BuiltinTypes.NUMBER, 1);

        Assertions.assertSame(only, CompositeTransformer.of(List.of(only)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CompositeTransformer.of(List.of()));
    }

    private static Transformer transformer(String id, String from, String to, double cost) {
        return Transformer.builder().id(id).fromType(from).toType(to).cost(cost).function(value -> value).build();
    }
}
