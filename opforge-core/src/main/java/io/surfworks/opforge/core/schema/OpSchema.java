package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.DeviceOption;
import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.ScalarType;
import io.surfworks.opforge.core.proto.TensorShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The schema of one operator type: legal input/output cardinality, in-place
 * aliasing rules, documentation, and functions that infer output shapes, cost
 * and device placement without running the operator.
 *
 * <p>Schemas are configured once, during registration, through chained setters:
 * <pre>{@code
 * OpSchemaRegistry.register("Sum")
 *     .numInputs(1, Integer.MAX_VALUE)
 *     .numOutputs(1)
 *     .allowInplace(Set.of(InplacePair.of(0, 0)))
 *     .identicalTypeAndShapeOfInput(0);
 * }</pre>
 *
 * <p>Every optional rule has a total default, so {@link #verify} and the
 * {@code infer*} methods can be called on any schema:
 * <ul>
 *   <li>cardinality and joint rules accept everything</li>
 *   <li>no in-place aliasing is allowed or enforced</li>
 *   <li>tensor inference marks every output as unknown</li>
 *   <li>device inference places everything on the operator's own device</li>
 *   <li>cost inference throws {@link CostInferenceUnavailableException}</li>
 * </ul>
 *
 * <p>Thread safety: setters are not synchronized. After registration the
 * schema is only read, and may be shared freely across threads.
 */
public final class OpSchema {

    private static final Logger LOGGER = Logger.getLogger(OpSchema.class.getName());

    /**
     * Returned by {@link #calculateOutput(int)} when the output count cannot be determined.
     */
    public static final int CANNOT_COMPUTE_NUM_OUTPUTS = -1;

    private static final IndexPairPredicate ANY_COUNTS = (inputs, outputs) -> true;

    private final String name;
    private final String file;
    private final int line;
    private final Level verifyLogLevel;

    private String doc = "";
    private final List<ArgumentDoc> argDocs = new ArrayList<>();
    private final List<TensorDoc> inputDocs = new ArrayList<>();
    private final List<TensorDoc> outputDocs = new ArrayList<>();
    private boolean privateOp;
    private boolean inputsCanCrossDevices;

    private CountRule inputRule = CountRule.unbounded();
    private CountRule outputRule = CountRule.unbounded();
    private IndexPairPredicate inputsOutputsRule = ANY_COUNTS;
    private IntUnaryOperator outputCalculator;

    private InplaceRule inplaceAllowed = InplaceRule.none();
    private InplaceRule inplaceEnforced = InplaceRule.none();

    private TensorInferenceFunction tensorInference = TensorInference.unknownOutputs();
    private boolean customTensorInference;
    private CostInferenceFunction costInference;
    private DeviceInferenceFunction deviceInference = OpSchema::defaultDevicePlacement;

    /**
     * Create a schema that is not bound to a source location.
     */
    public OpSchema(String name) {
        this(name, "unknown", 0);
    }

    /**
     * Create a schema registered from {@code file} at {@code line}. Verification
     * failures are logged at the level the registry was configured with.
     */
    public OpSchema(String name, String file, int line) {
        this(name, file, line, OpSchemaRegistry.config().verifyLogLevel());
    }

    OpSchema(String name, String file, int line, Level verifyLogLevel) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.file = Objects.requireNonNull(file, "file cannot be null");
        this.line = line;
        this.verifyLogLevel = verifyLogLevel;
    }

    // ==================== Identity ====================

    Level verifyLogLevel() {
        return verifyLogLevel;
    }

    /**
     * Returns the operator type name this schema describes.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the file that the schema is registered from.
     */
    public String file() {
        return file;
    }

    /**
     * Returns the line in {@link #file()} that the schema is registered from.
     */
    public int line() {
        return line;
    }

    // ==================== Verification ====================

    /**
     * Checks whether an operator instance satisfies this schema.
     *
     * <p>Never throws. The first failing rule is logged at the configured
     * verify level ({@code opforge.schema.verify.log}).
     *
     * @param def the operator instance
     * @return true if every rule holds
     * @see #verifyDetailed(OperatorDef)
     */
    public boolean verify(OperatorDef def) {
        VerificationResult result = verifyDetailed(def);
        if (!result.valid() && LOGGER.isLoggable(verifyLogLevel)) {
            LOGGER.log(verifyLogLevel, "Verification of {0} failed: {1}",
                new Object[] {def.type(), result.reason()});
        }
        return result.valid();
    }

    /**
     * Checks an operator instance against this schema and reports the first
     * failing rule.
     *
     * <p>Rules are checked in order: input count, output count, joint
     * input/output rule, calculated output count, in-place aliasing, required
     * arguments.
     */
    public VerificationResult verifyDetailed(OperatorDef def) {
        int numInputs = def.inputCount();
        int numOutputs = def.outputCount();

        if (!inputRule.accepts(numInputs)) {
            return VerificationResult.failed(
                "Input size " + numInputs + " not allowed, expected " + inputRule.describe());
        }
        if (!outputRule.accepts(numOutputs)) {
            return VerificationResult.failed(
                "Output size " + numOutputs + " not allowed, expected " + outputRule.describe());
        }
        if (!inputsOutputsRule.test(numInputs, numOutputs)) {
            return VerificationResult.failed(
                "Combination of input size " + numInputs + " and output size "
                    + numOutputs + " is not allowed");
        }
        if (outputCalculator != null) {
            int expected = outputCalculator.applyAsInt(numInputs);
            if (expected != CANNOT_COMPUTE_NUM_OUTPUTS && expected != numOutputs) {
                return VerificationResult.failed(
                    "Output size " + numOutputs + " not matching expected output size, which is "
                        + expected);
            }
        }

        for (int in = 0; in < numInputs; in++) {
            for (int out = 0; out < numOutputs; out++) {
                boolean sameBlob = def.input(in).equals(def.output(out));
                if (sameBlob && !inplaceAllowed.test(in, out) && !inplaceEnforced.test(in, out)) {
                    return VerificationResult.failed(
                        "Input index " + in + " and output index " + out + " (" + def.input(in)
                            + ") are set to be in-place but this is not supported by op " + def.type());
                }
                if (!sameBlob && inplaceEnforced.test(in, out)) {
                    return VerificationResult.failed(
                        "Input index " + in + " (" + def.input(in) + ") and output index " + out
                            + " (" + def.output(out) + ") should be in-place but are not");
                }
            }
        }

        for (ArgumentDoc arg : argDocs) {
            if (arg.required() && !def.hasArgument(arg.name())) {
                return VerificationResult.failed("Required argument '" + arg.name() + "' is missing");
            }
        }
        return VerificationResult.ok();
    }

    // ==================== Cardinality ====================

    /**
     * Exactly {@code n} inputs.
     */
    public OpSchema numInputs(int n) {
        return inputRule(CountRule.exactly(n));
    }

    /**
     * Between {@code min} and {@code max} inputs, inclusive.
     * Pass {@code Integer.MAX_VALUE} for no upper bound.
     */
    public OpSchema numInputs(int min, int max) {
        return inputRule(CountRule.between(min, max));
    }

    /**
     * Any input count in {@code allowed}.
     */
    public OpSchema numInputs(Set<Integer> allowed) {
        return inputRule(CountRule.oneOf(allowed));
    }

    /**
     * Any input count accepted by {@code predicate}.
     */
    public OpSchema numInputs(IntPredicate predicate) {
        return inputRule(CountRule.matching(predicate));
    }

    /**
     * Replace the input cardinality rule.
     */
    public OpSchema inputRule(CountRule rule) {
        this.inputRule = Objects.requireNonNull(rule, "rule cannot be null");
        return this;
    }

    public OpSchema numOutputs(int n) {
        return outputRule(CountRule.exactly(n));
    }

    public OpSchema numOutputs(int min, int max) {
        return outputRule(CountRule.between(min, max));
    }

    public OpSchema numOutputs(Set<Integer> allowed) {
        return outputRule(CountRule.oneOf(allowed));
    }

    public OpSchema numOutputs(IntPredicate predicate) {
        return outputRule(CountRule.matching(predicate));
    }

    public OpSchema outputRule(CountRule rule) {
        this.outputRule = Objects.requireNonNull(rule, "rule cannot be null");
        return this;
    }

    /**
     * Constrain the combination of input and output counts.
     * Checked in addition to the per-side rules.
     */
    public OpSchema numInputsOutputs(IndexPairPredicate rule) {
        this.inputsOutputsRule = Objects.requireNonNull(rule, "rule cannot be null");
        return this;
    }

    public CountRule inputRule() {
        return inputRule;
    }

    public CountRule outputRule() {
        return outputRule;
    }

    // ==================== Output count calculation ====================

    /**
     * Set the function computing the output count from the input count.
     * The function may return {@link #CANNOT_COMPUTE_NUM_OUTPUTS}.
     */
    public OpSchema outputCalculator(IntUnaryOperator calculator) {
        this.outputCalculator = Objects.requireNonNull(calculator, "calculator cannot be null");
        return this;
    }

    /**
     * As many outputs as inputs.
     */
    public OpSchema sameNumberOfOutputs() {
        return outputCalculator(IntUnaryOperator.identity());
    }

    /**
     * Number of outputs an instance with {@code numInputs} inputs has.
     *
     * <p>Uses the output calculator when one is registered, otherwise the
     * output rule if it admits a single count.
     *
     * @return the output count, or {@link #CANNOT_COMPUTE_NUM_OUTPUTS}
     */
    public int calculateOutput(int numInputs) {
        if (outputCalculator != null) {
            return outputCalculator.applyAsInt(numInputs);
        }
        return outputRule.fixedCount().orElse(CANNOT_COMPUTE_NUM_OUTPUTS);
    }

    // ==================== In-place ====================

    public OpSchema allowInplace(IndexPairPredicate rule) {
        this.inplaceAllowed = InplaceRule.matching(rule);
        return this;
    }

    public OpSchema allowInplace(Set<InplacePair> pairs) {
        this.inplaceAllowed = InplaceRule.pairs(pairs);
        return this;
    }

    /**
     * Output i may reuse the storage of input i.
     */
    public OpSchema allowOneToOneInplace() {
        this.inplaceAllowed = InplaceRule.oneToOne();
        return this;
    }

    public OpSchema enforceInplace(IndexPairPredicate rule) {
        this.inplaceEnforced = InplaceRule.matching(rule);
        return this;
    }

    public OpSchema enforceInplace(Set<InplacePair> pairs) {
        this.inplaceEnforced = InplaceRule.pairs(pairs);
        return this;
    }

    /**
     * Output i must reuse the storage of input i.
     */
    public OpSchema enforceOneToOneInplace() {
        this.inplaceEnforced = InplaceRule.oneToOne();
        return this;
    }

    public boolean inplaceAllowed(int input, int output) {
        return inplaceAllowed.test(input, output);
    }

    public boolean inplaceEnforced(int input, int output) {
        return inplaceEnforced.test(input, output);
    }

    public InplaceRule inplaceAllowedRule() {
        return inplaceAllowed;
    }

    public InplaceRule inplaceEnforcedRule() {
        return inplaceEnforced;
    }

    // ==================== Tensor inference ====================

    public OpSchema tensorInferenceFunction(TensorInferenceFunction function) {
        this.tensorInference = Objects.requireNonNull(function, "function cannot be null");
        this.customTensorInference = true;
        return this;
    }

    /**
     * Output i has the type and shape of input i.
     */
    public OpSchema identicalTypeAndShape() {
        return tensorInferenceFunction(TensorInference.identicalTypeAndShape());
    }

    /**
     * Every output has the type and shape of input {@code index}.
     */
    public OpSchema identicalTypeAndShapeOfInput(int index) {
        return tensorInferenceFunction(TensorInference.identicalTypeAndShapeOfInput(index));
    }

    /**
     * Every output is 1-D, sized by dimension {@code dim} of input {@code index}.
     */
    public OpSchema identicalTypeAndShapeOfInputDim(int index, int dim) {
        return tensorInferenceFunction(TensorInference.identicalTypeAndShapeOfInputDim(index, dim));
    }

    /**
     * Outputs keep the input shapes but have element type {@code type}.
     */
    public OpSchema scalarType(ScalarType type) {
        return tensorInferenceFunction(TensorInference.scalarType(type));
    }

    /**
     * Whether a tensor inference function was registered. When false,
     * {@link #inferTensor} returns unknown shapes by default rather than
     * because a function decided so.
     */
    public boolean hasTensorInferenceFunction() {
        return customTensorInference;
    }

    /**
     * Infer the type and shape of each output.
     *
     * @param def         the operator instance
     * @param inputShapes type and shape of each input
     * @return one shape per output of {@code def}
     */
    public List<TensorShape> inferTensor(OperatorDef def, List<TensorShape> inputShapes) {
        return tensorInference.infer(def, inputShapes);
    }

    // ==================== Cost inference ====================

    public OpSchema costInferenceFunction(CostInferenceFunction function) {
        this.costInference = Objects.requireNonNull(function, "function cannot be null");
        return this;
    }

    public boolean hasCostInferenceFunction() {
        return costInference != null;
    }

    /**
     * Estimate the cost of running {@code def}.
     *
     * @throws CostInferenceUnavailableException if no cost function is registered
     */
    public Cost inferCost(OperatorDef def, List<TensorShape> inputShapes) {
        if (costInference == null) {
            throw new CostInferenceUnavailableException(name);
        }
        return costInference.infer(def, inputShapes);
    }

    // ==================== Device inference ====================

    public OpSchema deviceInferenceFunction(DeviceInferenceFunction function) {
        this.deviceInference = Objects.requireNonNull(function, "function cannot be null");
        return this;
    }

    /**
     * Required device of each input and output of {@code def}.
     */
    public DevicePlacement inferDevice(OperatorDef def) {
        return deviceInference.infer(def);
    }

    private static DevicePlacement defaultDevicePlacement(OperatorDef def) {
        DeviceOption device = def.deviceOption().orElse(DeviceOption.DEFAULT);
        return DevicePlacement.uniform(device, def.inputCount(), def.outputCount());
    }

    // ==================== Documentation ====================

    public OpSchema doc(String doc) {
        this.doc = Objects.requireNonNull(doc, "doc cannot be null");
        return this;
    }

    /**
     * Returns the doc string, or an empty string if none was set.
     */
    public String doc() {
        return doc;
    }

    public OpSchema describeArgument(String argName, String description) {
        return describeArgument(argName, description, false);
    }

    /**
     * Document an argument. Required arguments are checked by {@link #verify}.
     */
    public OpSchema describeArgument(String argName, String description, boolean required) {
        argDocs.add(new ArgumentDoc(
            Objects.requireNonNull(argName, "argName cannot be null"), description, required));
        return this;
    }

    public OpSchema describeInput(int index, String inputName, String description) {
        inputDocs.add(new TensorDoc(index, inputName, description));
        return this;
    }

    public OpSchema describeOutput(int index, String outputName, String description) {
        outputDocs.add(new TensorDoc(index, outputName, description));
        return this;
    }

    public List<ArgumentDoc> argumentDocs() {
        return Collections.unmodifiableList(argDocs);
    }

    public List<TensorDoc> inputDocs() {
        return Collections.unmodifiableList(inputDocs);
    }

    public List<TensorDoc> outputDocs() {
        return Collections.unmodifiableList(outputDocs);
    }

    /**
     * Exclude this schema from generated documentation.
     */
    public OpSchema markPrivate() {
        this.privateOp = true;
        return this;
    }

    public boolean isPrivate() {
        return privateOp;
    }

    /**
     * Declare that inputs may live on devices other than the operator's own.
     */
    public OpSchema inputsCanCrossDevices() {
        this.inputsCanCrossDevices = true;
        return this;
    }

    public boolean allowsInputsAcrossDevices() {
        return inputsCanCrossDevices;
    }

    /**
     * Call {@code populator} with this schema. Lets shared helper code
     * configure families of similar operators.
     */
    public OpSchema fillUsing(Consumer<OpSchema> populator) {
        populator.accept(this);
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("OpSchema ").append(name)
            .append(" (").append(file).append(':').append(line).append(")\n");
        if (!doc.isEmpty()) {
            sb.append(doc.strip()).append('\n');
        }
        if (!argDocs.isEmpty()) {
            sb.append("Arguments:\n");
            for (ArgumentDoc arg : argDocs) {
                sb.append("  ").append(arg.name())
                    .append(arg.required() ? " (required)" : "")
                    .append(" : ").append(arg.description()).append('\n');
            }
        }
        if (!inputDocs.isEmpty()) {
            sb.append("Inputs:\n");
            for (TensorDoc input : inputDocs) {
                sb.append("  ").append(input.index()).append(", ").append(input.name())
                    .append(" : ").append(input.description()).append('\n');
            }
        }
        if (!outputDocs.isEmpty()) {
            sb.append("Outputs:\n");
            for (TensorDoc output : outputDocs) {
                sb.append("  ").append(output.index()).append(", ").append(output.name())
                    .append(" : ").append(output.description()).append('\n');
            }
        }
        sb.append("Number of inputs: ").append(inputRule.describe()).append('\n');
        sb.append("Number of outputs: ").append(outputRule.describe());
        return sb.toString();
    }
}
