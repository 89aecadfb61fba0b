package io.surfworks.warpedit.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.warpedit.core.edit.Placeholders;
import io.surfworks.warpedit.core.graph.Graph;
import io.surfworks.warpedit.core.graph.Operation;
import io.surfworks.warpedit.core.graph.ScalarType;
import io.surfworks.warpedit.core.graph.Shape;
import io.surfworks.warpedit.core.graph.Tensor;
import io.surfworks.warpedit.core.graph.TensorType;
import io.surfworks.warpedit.core.select.SubGraphView;
import io.surfworks.warpedit.transform.config.TransformConfig;

/**
 * Tests for the subgraph transformer.
 */
@DisplayName("Transformer")
class TransformerTest {

    private static final TensorType F32_2x3 = TensorType.of(ScalarType.F32, 2, 3);

    private Graph src;
    private Graph dst;
    private Operation x;
    private Operation y;
    private Operation z;

    /**
     * x -> y = neg(x) -> z = exp(y)
     */
    @BeforeEach
    void setUp() {
        src = new Graph("src");
        dst = new Graph("dst");
        x = placeholder(src, "x");
        y = unary(src, "Neg", "y", x.output(0));
        z = unary(src, "Exp", "z", y.output(0));
    }

    private static Operation placeholder(Graph graph, String name) {
        return graph.opBuilder(Placeholders.OP_TYPE, name).output(F32_2x3).build();
    }

    private static Operation unary(Graph graph, String type, String name, Tensor input) {
        return graph.opBuilder(type, name).input(input).output(F32_2x3).build();
    }

    private static Operation binary(Graph graph, String type, String name, Tensor lhs, Tensor rhs) {
        return graph.opBuilder(type, name).input(lhs).input(rhs).output(F32_2x3).build();
    }

    // ==================== Copy ====================

    @Nested
    @DisplayName("Copy into another graph")
    class CrossGraphCopyTests {

        @Test
        @DisplayName("copies members and stands placeholders in for inputs")
        void copiesWithPlaceholders() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(y, z)), dst, "b");

            assertEquals(3, dst.operationCount());
            Operation y_ = dst.operation("b/y").orElseThrow();
            Operation z_ = dst.operation("b/z").orElseThrow();
            Operation ph = dst.operation("b/geph__x_0").orElseThrow();

            assertEquals(Placeholders.OP_TYPE, ph.type());
            assertSame(ph.output(0), y_.input(0));
            assertSame(y_.output(0), z_.input(0));
            assertEquals("Exp", z_.type());

            assertEquals(List.of(ph.output(0)), out.view().inputs());
            assertEquals(List.of(z_.output(0)), out.view().outputs());
        }

        @Test
        @DisplayName("leaves the source graph untouched")
        void sourceUntouched() {
            new Transformer().transform(SubGraphView.of(List.of(y, z)), dst, "");

            assertEquals(3, src.operationCount());
            assertEquals(List.of(z), y.output(0).consumers());
            assertSame(x.output(0), y.input(0));
        }

        @Test
        @DisplayName("keeps static shapes")
        void keepsShapes() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(y, z)), dst, "");
            Tensor z_ = out.result().transformed(z.output(0)).orElseThrow();

            assertEquals(Shape.of(2, 3), z_.shape());
            assertEquals(ScalarType.F32, z_.dtype());
        }

        @Test
        @DisplayName("drops static shapes when configured to")
        void dropsShapes() {
            Transformer transformer = new Transformer(TransformConfig.defaults().withCopyShape(false));
            TransformOutput out = transformer.transform(SubGraphView.of(List.of(y, z)), dst, "");
            Tensor z_ = out.result().transformed(z.output(0)).orElseThrow();

            assertFalse(z_.shape().hasKnownRank());
            assertEquals(ScalarType.F32, z_.dtype());
        }

        @Test
        @DisplayName("uses the configured placeholder prefix")
        void customPrefix() {
            Transformer transformer = new Transformer(TransformConfig.defaults().withPlaceholderPrefix("in"));
            transformer.transform(SubGraphView.of(List.of(y)), dst, "");

            assertTrue(dst.operation("in__x_0").isPresent());
        }

        @Test
        @DisplayName("copies node attributes")
        void copiesAttributes() {
            Operation scaled = src.opBuilder("Scale", "scaled")
                    .input(z.output(0))
                    .attribute("factor", 2.5)
                    .output(F32_2x3)
                    .build();

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(scaled)), dst, "");
            Operation scaled_ = out.result().transformed(scaled).orElseThrow();

            Double factor = scaled_.nodeDef().attribute("factor");
            assertEquals(2.5, factor);
        }
    }

    @Nested
    @DisplayName("Memoization")
    class MemoizationTests {

        @Test
        @DisplayName("translates every operation and input exactly once")
        void translatesOnce() {
            // p and q both read x; r reads p and q; s reads p and r
            Operation p = unary(src, "Neg", "p", x.output(0));
            Operation q = unary(src, "Exp", "q", x.output(0));
            Operation r = binary(src, "Add", "r", p.output(0), q.output(0));
            Operation s = binary(src, "Mul", "s", p.output(0), r.output(0));

            Map<Operation, Integer> calls = new IdentityHashMap<>();
            TransformHandlers handlers = TransformHandlers.defaults().withOpHandler((ctx, op) -> {
                calls.merge(op, 1, Integer::sum);
                return DefaultHandlers.copyOp(ctx, op, true);
            });

            new Transformer(handlers).transform(SubGraphView.of(List.of(p, q, r, s)), dst, "");

            assertEquals(4, calls.size());
            for (int count : calls.values()) {
                assertEquals(1, count);
            }
            // x:0 feeds two members but gets a single placeholder
            long placeholders = dst.operations().stream()
                    .filter(op -> op.type().equals(Placeholders.OP_TYPE))
                    .count();
            assertEquals(1, placeholders);
            assertEquals(5, dst.operationCount());
        }

        @Test
        @DisplayName("copies long chains")
        void copiesLongChains() {
            Tensor t = x.output(0);
            Operation last = null;
            for (int i = 0; i < 5000; i++) {
                last = unary(src, "Neg", "n" + i, t);
                t = last.output(0);
            }
            List<Operation> chain = src.operations().subList(3, src.operationCount());

            TransformOutput out = new Transformer().transform(SubGraphView.of(chain), dst, "");

            assertEquals(5001, dst.operationCount());
            assertEquals("n4999", out.result().transformed(last).orElseThrow().name());
        }
    }

    // ==================== Naming ====================

    @Nested
    @DisplayName("Naming")
    class NamingTests {

        @Test
        @DisplayName("renames from the source scope to the destination scope")
        void renamesScopes() {
            Operation in = placeholder(src, "a/in");
            Operation deep = unary(src, "Neg", "a/x/y", in.output(0));

            TransformOutput out = new Transformer()
                    .transform(SubGraphView.of(List.of(deep)), dst, "b", "a", true);

            assertEquals("b/x/y", out.result().transformed(deep).orElseThrow().name());
            assertEquals("a/", out.result().sourceScope());
            assertEquals("b/", out.result().destinationScope());
        }

        @Test
        @DisplayName("rejects names outside the source scope")
        void rejectsNamesOutsideSourceScope() {
            ScopeMismatchException e = assertThrows(ScopeMismatchException.class, () ->
                    new Transformer().transform(SubGraphView.of(List.of(y)), dst, "b", "a", false));

            assertEquals("y", e.getName());
            assertEquals("a/", e.getScope());
        }

        @Test
        @DisplayName("makes the destination scope unique unless reused")
        void uniqueDestinationScope() {
            SubGraphView view = SubGraphView.of(List.of(y, z));

            TransformOutput first = new Transformer().transform(view, src, "copy", "", false);
            TransformOutput second = new Transformer().transform(view, src, "copy", "", false);
            TransformOutput reused = new Transformer().transform(view, src, "copy", "", true);

            assertEquals("copy/", first.result().destinationScope());
            assertEquals("copy_1/", second.result().destinationScope());
            assertEquals("copy/", reused.result().destinationScope());
            assertEquals("copy/z", first.result().transformed(z).orElseThrow().name());
            assertEquals("copy_1/z", second.result().transformed(z).orElseThrow().name());
            assertEquals("copy/z_1", reused.result().transformed(z).orElseThrow().name());
        }

        @Test
        @DisplayName("makes names unique when copying within one graph")
        void uniqueNamesInSameGraph() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(y, z)), src, "");

            assertEquals("y_1", out.result().transformed(y).orElseThrow().name());
            assertEquals("z_1", out.result().transformed(z).orElseThrow().name());
        }
    }

    // ==================== Boundaries ====================

    @Nested
    @DisplayName("Boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("orders the transformed boundary like the source view")
        void keepsBoundaryOrder() {
            Operation a = placeholder(src, "a");
            Operation b = placeholder(src, "b");
            Operation c = binary(src, "Add", "c", a.output(0), b.output(0));
            SubGraphView view = SubGraphView.of(List.of(c)).remapInputs(List.of(1, 0));

            TransformOutput out = new Transformer().transform(view, dst, "");

            Tensor phA = dst.operation("geph__a_0").orElseThrow().output(0);
            Tensor phB = dst.operation("geph__b_0").orElseThrow().output(0);
            assertEquals(List.of(phB, phA), out.view().inputs());
        }

        @Test
        @DisplayName("keeps hidden inputs when copying within one graph")
        void keepsHiddenInputs() {
            // y:0 is read by z but not declared as an input of the view
            SubGraphView view = SubGraphView.of(List.of(z), List.of(), List.of(z.output(0)));

            TransformOutput out = new Transformer().transform(view, src, "");
            Operation z_ = out.result().transformed(z).orElseThrow();

            assertSame(y.output(0), z_.input(0));
            assertEquals(4, src.operationCount());
        }

        @Test
        @DisplayName("replaces declared inputs by placeholders even within one graph")
        void placeholdersWithinOneGraph() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(z)), src, "");
            Operation z_ = out.result().transformed(z).orElseThrow();

            assertEquals(Placeholders.OP_TYPE, z_.input(0).op().type());
            assertNotSame(y.output(0), z_.input(0));
        }

        @Test
        @DisplayName("transforms members without outputs")
        void transformsRootsWithoutOutputs() {
            Operation train = src.opBuilder("NoOp", "train").controlInput(z).build();

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(y, z, train)), dst, "");

            Operation train_ = out.result().transformed(train).orElseThrow();
            Operation z_ = out.result().transformed(z).orElseThrow();
            assertEquals(List.of(z_), train_.controlInputs());
        }

        @Test
        @DisplayName("skips members whose outputs are all hidden")
        void skipsUnreachableMembersWithOutputs() {
            SubGraphView view = SubGraphView.of(List.of(y, z), List.of(x.output(0)), List.of());

            TransformOutput out = new Transformer().transform(view, dst, "");

            assertTrue(out.result().opMapping().isEmpty());
            assertEquals(0, dst.operationCount());
        }

        @Test
        @DisplayName("transforms an empty view to an empty view")
        void emptyView() {
            TransformOutput out = new Transformer().transform(SubGraphView.empty(), dst, "");

            assertTrue(out.view().isEmpty());
            assertTrue(out.result().opMapping().isEmpty());
        }

        @Test
        @DisplayName("orders the transformed outputs like the source view")
        void keepsOutputOrder() {
            Operation a = placeholder(src, "a");
            Operation p = unary(src, "Neg", "p", a.output(0));
            Operation q = unary(src, "Exp", "q", a.output(0));
            SubGraphView view = SubGraphView.of(List.of(p, q)).remapOutputs(List.of(1, 0));

            TransformOutput out = new Transformer().transform(view, dst, "");

            Operation p_ = out.result().transformed(p).orElseThrow();
            Operation q_ = out.result().transformed(q).orElseThrow();
            assertEquals(List.of(q_.output(0), p_.output(0)), out.view().outputs());
        }

        @Test
        @DisplayName("drops outputs that only outside operations consumed")
        void dropsOutputsInternalToCopy() {
            // y:0 is an output of the view only because e reads it
            unary(src, "Abs", "e", y.output(0));
            SubGraphView view = SubGraphView.of(List.of(y, z));
            assertEquals(List.of(y.output(0), z.output(0)), view.outputs());

            TransformOutput out = new Transformer().transform(view, dst, "");

            Operation z_ = out.result().transformed(z).orElseThrow();
            assertEquals(List.of(z_.output(0)), out.view().outputs());
        }

        @Test
        @DisplayName("copying onto the same graph preserves the view's structure")
        void sameGraphCopyKeepsStructure() {
            SubGraphView view = SubGraphView.of(List.of(y, z));

            TransformOutput out = new Transformer().transform(view, src, "", "", true);
            SubGraphView copied = out.view();

            assertEquals(view.ops().size(), copied.ops().size());
            assertEquals(view.inputs().size(), copied.inputs().size());
            assertEquals(view.outputs().size(), copied.outputs().size());
            assertEquals(edgeCount(view), edgeCount(copied));
            for (Operation op : view.ops()) {
                Operation op_ = out.result().transformed(op).orElseThrow();
                assertNotSame(op, op_);
                assertTrue(copied.contains(op_));
                assertEquals(op.type(), op_.type());
                assertEquals(op.inputs().size(), op_.inputs().size());
                for (int i = 0; i < op.inputs().size(); i++) {
                    Tensor input = op.input(i);
                    if (view.contains(input.op())) {
                        Operation producer_ = out.result().transformed(input.op()).orElseThrow();
                        assertSame(producer_.output(input.valueIndex()), op_.input(i));
                    } else {
                        assertTrue(copied.isInput(op_.input(i)));
                    }
                }
            }
        }

        private int edgeCount(SubGraphView view) {
            int edges = 0;
            for (Operation op : view.ops()) {
                edges += op.inputs().size();
            }
            return edges;
        }
    }

    // ==================== Control edges ====================

    @Nested
    @DisplayName("Control edges")
    class ControlEdgeTests {

        private Operation init;
        private Operation guarded;

        @BeforeEach
        void setUpControl() {
            init = src.opBuilder("NoOp", "init").build();
            guarded = src.opBuilder("Neg", "guarded").input(z.output(0)).controlInput(init).output(F32_2x3).build();
        }

        @Test
        @DisplayName("drops outside control inputs across graphs")
        void dropsOutsideControlInputsAcrossGraphs() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(guarded)), dst, "");

            assertTrue(out.result().transformed(guarded).orElseThrow().controlInputs().isEmpty());
        }

        @Test
        @DisplayName("keeps outside control inputs within one graph")
        void keepsOutsideControlInputsWithinOneGraph() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(guarded)), src, "");

            assertEquals(List.of(init), out.result().transformed(guarded).orElseThrow().controlInputs());
        }

        @Test
        @DisplayName("drops outside control inputs within one graph when configured to")
        void dropsWhenConfigured() {
            Transformer transformer = new Transformer(
                    TransformConfig.defaults().withKeepControlInputsIfPossible(false));
            TransformOutput out = transformer.transform(SubGraphView.of(List.of(guarded)), src, "");

            assertTrue(out.result().transformed(guarded).orElseThrow().controlInputs().isEmpty());
        }

        @Test
        @DisplayName("translates member control inputs")
        void translatesMemberControlInputs() {
            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(init, guarded)), dst, "");

            Operation init_ = out.result().transformed(init).orElseThrow();
            assertEquals(List.of(init_), out.result().transformed(guarded).orElseThrow().controlInputs());
            assertSame(dst, init_.graph());
        }

        @Test
        @DisplayName("closes control cycles once both ends exist")
        void closesControlCycles() {
            Operation a = src.opBuilder("NoOp", "loop_a").build();
            Operation b = src.opBuilder("NoOp", "loop_b").controlInput(a).build();
            src.addControlInput(a, b);

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(a, b)), dst, "");

            Operation a_ = out.result().transformed(a).orElseThrow();
            Operation b_ = out.result().transformed(b).orElseThrow();
            assertEquals(List.of(b_), a_.controlInputs());
            assertEquals(List.of(a_), b_.controlInputs());
        }

        @Test
        @DisplayName("closes control cycles running back through data edges")
        void closesControlCyclesThroughDataEdges() {
            // a feeds b, and a waits on b
            Operation a = src.opBuilder("Const", "c_a").output(F32_2x3).build();
            Operation b = unary(src, "Neg", "c_b", a.output(0));
            src.addControlInput(a, b);

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(a, b)), dst, "");

            Operation a_ = out.result().transformed(a).orElseThrow();
            Operation b_ = out.result().transformed(b).orElseThrow();
            assertEquals(List.of(b_), a_.controlInputs());
            assertSame(a_.output(0), b_.input(0));
            assertEquals(2, dst.operationCount());
        }

        @Test
        @DisplayName("closes control cycles through a chain of members")
        void closesLongerControlCycles() {
            Operation a = src.opBuilder("Const", "c_a").output(F32_2x3).build();
            Operation b = unary(src, "Neg", "c_b", a.output(0));
            Operation c = unary(src, "Exp", "c_c", b.output(0));
            src.addControlInput(a, c);

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(a, b, c)), dst, "");

            Operation a_ = out.result().transformed(a).orElseThrow();
            Operation c_ = out.result().transformed(c).orElseThrow();
            assertEquals(List.of(c_), a_.controlInputs());
            assertSame(out.result().transformed(b).orElseThrow().output(0), c_.input(0));
        }

        @Test
        @DisplayName("rejects data cycles")
        void rejectsDataCycles() {
            Operation p = placeholder(src, "p");
            Operation q = unary(src, "Neg", "q", p.output(0));
            Operation r = unary(src, "Neg", "r", q.output(0));
            src.rerouteConsumers(p.output(0), r.output(0));

            SubGraphView view = SubGraphView.of(List.of(q, r), List.of(), List.of(r.output(0)));

            assertThrows(IllegalStateException.class, () -> new Transformer().transform(view, dst, ""));
        }

        @Test
        @DisplayName("applies the destination's ambient control dependencies to new operations")
        void appliesAmbientControlDependencies() {
            Operation guard = dst.opBuilder("NoOp", "guard").build();

            TransformOutput out;
            try (var scope = dst.controlDependencies().push(List.of(guard))) {
                out = new Transformer().transform(SubGraphView.of(List.of(x, y)), dst, "");
            }

            // y_ reads x_, created under the same frame, so it depends on guard transitively
            assertEquals(List.of(guard), out.result().transformed(x).orElseThrow().controlInputs());
            assertTrue(out.result().transformed(y).orElseThrow().controlInputs().isEmpty());
        }

        @Test
        @DisplayName("applies the destination's ambient device to new operations")
        void appliesAmbientDevice() {
            TransformOutput out;
            try (var scope = dst.devices().push("/gpu:1")) {
                out = new Transformer().transform(SubGraphView.of(List.of(y, z)), dst, "");
            }

            assertEquals("/gpu:1", out.result().transformed(y).orElseThrow().device());
            assertEquals("/gpu:1", out.result().transformed(z).orElseThrow().device());
        }
    }

    // ==================== Provenance ====================

    @Test
    @DisplayName("translates original-op links to members")
    void translatesOriginalOpLinks() {
        Operation shadow = src.opBuilder("Identity", "shadow").input(z.output(0)).originalOp(y).output(F32_2x3).build();

        TransformOutput inside = new Transformer().transform(SubGraphView.of(List.of(y, z, shadow)), dst, "in");
        TransformOutput outside = new Transformer().transform(SubGraphView.of(List.of(shadow)), dst, "out");

        assertSame(inside.result().transformed(y).orElseThrow(),
                inside.result().transformed(shadow).orElseThrow().originalOp().orElseThrow());
        assertTrue(outside.result().transformed(shadow).orElseThrow().originalOp().isEmpty());
    }

    // ==================== Collections ====================

    @Nested
    @DisplayName("Collections")
    class CollectionTests {

        @Test
        @DisplayName("renames collections into the destination scope")
        void renamesCollections() {
            src.addToCollection("losses", z);
            src.addToCollection("activations", y.output(0));

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(y, z)), dst, "b");

            Operation z_ = out.result().transformed(z).orElseThrow();
            Tensor y_ = out.result().transformed(y.output(0)).orElseThrow();
            assertEquals(List.of(z_), dst.collection("b/losses"));
            assertEquals(List.of(y_), dst.collection("b/activations"));
        }

        @Test
        @DisplayName("keeps collection names outside the source scope")
        void keepsNamesOutsideSourceScope() {
            Operation in = placeholder(src, "a/in");
            Operation op = unary(src, "Neg", "a/op", in.output(0));
            src.addToCollection("shared", op);
            src.addToCollection("a/local", op);

            TransformOutput out = new Transformer().transform(SubGraphView.of(List.of(op)), dst, "b", "a", false);

            Operation op_ = out.result().transformed(op).orElseThrow();
            assertEquals(List.of(op_), dst.collection("shared"));
            assertEquals(List.of(op_), dst.collection("b/local"));
        }

        @Test
        @DisplayName("leaves untranslated elements out of collections")
        void untranslatedElementsNotAdded() {
            src.addToCollection("inputs", x);

            new Transformer().transform(SubGraphView.of(List.of(y)), dst, "");

            assertTrue(dst.collectionNames().isEmpty());
        }
    }

    // ==================== Lifecycle ====================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("rejects a missing destination")
        void rejectsNullDestination() {
            assertThrows(InvalidDestinationException.class,
                    () -> new Transformer().transform(SubGraphView.of(List.of(y)), null, ""));
        }

        @Test
        @DisplayName("rejects a finalized destination")
        void rejectsFinalizedDestination() {
            dst.finalizeGraph();

            assertThrows(InvalidDestinationException.class,
                    () -> new Transformer().transform(SubGraphView.of(List.of(y)), dst, ""));
        }

        @Test
        @DisplayName("cannot be re-entered from a handler")
        void notReentrant() {
            AtomicBoolean sawRunning = new AtomicBoolean();
            TransformHandlers handlers = TransformHandlers.defaults().withOpHandler((ctx, op) -> {
                sawRunning.set(ctx.transformer().isRunning());
                ctx.transformer().transform(SubGraphView.of(List.of(op)), new Graph(), "");
                return DefaultHandlers.copyOp(ctx, op, true);
            });
            Transformer transformer = new Transformer(handlers);

            assertThrows(IllegalStateException.class,
                    () -> transformer.transform(SubGraphView.of(List.of(y)), dst, ""));
            assertTrue(sawRunning.get());
            assertFalse(transformer.isRunning());
        }

        @Test
        @DisplayName("can be reused after a call")
        void reusable() {
            Transformer transformer = new Transformer();
            SubGraphView view = SubGraphView.of(List.of(y, z));

            TransformOutput first = transformer.transform(view, dst, "one");
            TransformOutput second = transformer.transform(view, dst, "two");

            assertEquals("one/z", first.result().transformed(z).orElseThrow().name());
            assertEquals("two/z", second.result().transformed(z).orElseThrow().name());
            assertEquals(2, second.result().opMapping().size());
        }
    }
}
