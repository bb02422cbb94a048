package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.ScalarType;
import io.surfworks.opforge.core.proto.TensorShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TensorInference")
class TensorInferenceTest {

    private static final TensorShape F32_2x3 = TensorShape.of(ScalarType.F32, 2, 3);
    private static final TensorShape I64_5 = TensorShape.of(ScalarType.I64, 5);

    private static OperatorDef outputs(int numOutputs) {
        OperatorDef.Builder builder = OperatorDef.builder("Test").input("x");
        for (int i = 0; i < numOutputs; i++) {
            builder.output("y" + i);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("identicalTypeAndShape")
    class Identical {

        @Test
        @DisplayName("Output i copies input i")
        void copiesPositionally() {
            List<TensorShape> out = TensorInference.identicalTypeAndShape()
                .infer(outputs(2), List.of(F32_2x3, I64_5));
            assertEquals(List.of(F32_2x3, I64_5), out);
        }

        @Test
        @DisplayName("Fails when an output has no matching input")
        void missingInput() {
            var ex = assertThrows(IllegalArgumentException.class,
                () -> TensorInference.identicalTypeAndShape().infer(outputs(2), List.of(F32_2x3)));
            assertTrue(ex.getMessage().contains("input 1"));
        }
    }

    @Nested
    @DisplayName("identicalTypeAndShapeOfInput")
    class OfInput {

        @Test
        @DisplayName("One input [2,3] F32 and two outputs gives two copies")
        void copiesToEveryOutput() {
            List<TensorShape> out = TensorInference.identicalTypeAndShapeOfInput(0)
                .infer(outputs(2), List.of(F32_2x3));
            assertEquals(2, out.size());
            assertEquals(F32_2x3, out.get(0));
            assertEquals(F32_2x3, out.get(1));
        }

        @Test
        void usesSelectedInput() {
            List<TensorShape> out = TensorInference.identicalTypeAndShapeOfInput(1)
                .infer(outputs(1), List.of(F32_2x3, I64_5));
            assertEquals(List.of(I64_5), out);
        }

        @Test
        void missingInputFails() {
            assertThrows(IllegalArgumentException.class,
                () -> TensorInference.identicalTypeAndShapeOfInput(3).infer(outputs(1), List.of(F32_2x3)));
        }

        @Test
        void negativeIndexRejectedEagerly() {
            assertThrows(IllegalArgumentException.class, () -> TensorInference.identicalTypeAndShapeOfInput(-1));
        }
    }

    @Nested
    @DisplayName("identicalTypeAndShapeOfInputDim")
    class OfInputDim {

        @Test
        @DisplayName("Outputs are 1-D, sized by the chosen dimension")
        void oneDimensional() {
            List<TensorShape> out = TensorInference.identicalTypeAndShapeOfInputDim(0, 1)
                .infer(outputs(2), List.of(F32_2x3));
            TensorShape expected = TensorShape.of(ScalarType.F32, 3);
            assertEquals(List.of(expected, expected), out);
        }

        @Test
        void dimensionBeyondRankFails() {
            var ex = assertThrows(IllegalArgumentException.class,
                () -> TensorInference.identicalTypeAndShapeOfInputDim(0, 2).infer(outputs(1), List.of(F32_2x3)));
            assertTrue(ex.getMessage().contains("no dimension 2"));
        }
    }

    @Nested
    @DisplayName("scalarType")
    class ScalarTypeTests {

        @Test
        @DisplayName("Keeps input shapes and forces the element type")
        void forcesType() {
            List<TensorShape> out = TensorInference.scalarType(ScalarType.BOOL)
                .infer(outputs(2), List.of(F32_2x3, I64_5));
            assertEquals(List.of(
                TensorShape.of(ScalarType.BOOL, 2, 3),
                TensorShape.of(ScalarType.BOOL, 5)), out);
        }

        @Test
        @DisplayName("Extra outputs take input 0's shape")
        void extraOutputsUseFirstInput() {
            List<TensorShape> out = TensorInference.scalarType(ScalarType.I32)
                .infer(outputs(2), List.of(F32_2x3));
            assertEquals(TensorShape.of(ScalarType.I32, 2, 3), out.get(1));
        }

        @Test
        @DisplayName("Without inputs outputs are scalars")
        void noInputs() {
            OperatorDef def = OperatorDef.builder("Const").output("c").build();
            List<TensorShape> out = TensorInference.scalarType(ScalarType.F64).infer(def, List.of());
            assertEquals(List.of(TensorShape.of(ScalarType.F64)), out);
        }
    }

    @Test
    @DisplayName("unknownOutputs yields one unknown shape per output")
    void unknownOutputs() {
        List<TensorShape> out = TensorInference.unknownOutputs().infer(outputs(3), List.of(F32_2x3));
        assertEquals(List.of(TensorShape.unknown(), TensorShape.unknown(), TensorShape.unknown()), out);
    }
}
