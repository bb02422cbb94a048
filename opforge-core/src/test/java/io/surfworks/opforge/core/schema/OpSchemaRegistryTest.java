package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.DeviceOption;
import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.ScalarType;
import io.surfworks.opforge.core.proto.TensorShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * The registry is process-wide, so every test registers names of its own.
 */
@DisplayName("OpSchemaRegistry")
class OpSchemaRegistryTest {

    private static String uniqueName(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Registering Sum once then looking it up returns the registered schema")
        void registerAndLookup() {
            OpSchema created = OpSchemaRegistry.newSchema("Sum", "elementwise_sum_op.java", 42);

            OpSchema found = OpSchemaRegistry.schema("Sum").orElseThrow();
            assertSame(created, found);
            assertEquals("Sum", found.name());
            assertEquals("elementwise_sum_op.java", found.file());
            assertEquals(42, found.line());

            var error = assertThrows(DuplicateSchemaError.class,
                () -> OpSchemaRegistry.newSchema("Sum", "other_file.java", 7));
            assertEquals("Sum", error.schemaName());
            assertEquals("other_file.java", error.file());
            assertEquals(7, error.line());
            assertEquals("elementwise_sum_op.java", error.existingFile());
            assertEquals(42, error.existingLine());
            assertTrue(error.getMessage().contains("other_file.java line 7"));
            assertTrue(error.getMessage().contains("elementwise_sum_op.java line 42"));

            assertSame(created, OpSchemaRegistry.schema("Sum").orElseThrow(),
                "Rejected registration must not replace the existing schema");
        }

        @Test
        @DisplayName("Duplicate registration is an Error, not an Exception")
        void duplicateIsFatal() {
            String name = uniqueName("Dup");
            OpSchemaRegistry.newSchema(name, "a.java", 1);
            Throwable thrown = assertThrows(Throwable.class, () -> OpSchemaRegistry.newSchema(name, "b.java", 2));
            assertTrue(thrown instanceof Error);
            assertFalse(thrown instanceof Exception);
        }

        @Test
        @DisplayName("register() records the calling file and line")
        void registerRecordsCallSite() {
            String name = uniqueName("CallSite");
            OpSchema schema = OpSchemaRegistry.register(name);

            assertEquals("OpSchemaRegistryTest.java", schema.file());
            assertTrue(schema.line() > 0);
        }

        @Test
        @DisplayName("The returned schema is configured in place")
        void builderChainConfiguresRegisteredSchema() {
            String name = uniqueName("Chain");
            OpSchemaRegistry.register(name).numInputs(2).numOutputs(1);

            OpSchema schema = OpSchemaRegistry.schema(name).orElseThrow();
            OperatorDef ok = OperatorDef.builder(name).inputs("a", "b").output("c").build();
            OperatorDef bad = OperatorDef.builder(name).input("a").output("c").build();
            assertTrue(schema.verify(ok));
            assertFalse(schema.verify(bad));
        }

        @Test
        @DisplayName("Concurrent registration of one name admits exactly one winner")
        void concurrentRegistration() throws Exception {
            String name = uniqueName("Race");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    int line = i;
                    results.add(pool.submit(() -> {
                        try {
                            OpSchemaRegistry.newSchema(name, "race.java", line);
                            return true;
                        } catch (DuplicateSchemaError e) {
                            return false;
                        }
                    }));
                }
                int winners = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Provider loading")
    class ProviderLoading {

        @Test
        @DisplayName("Providers run in order and register their schemas")
        void providersRegisterSchemas() {
            String first = uniqueName("First");
            String second = uniqueName("Second");
            List<OpSchemaProvider> providers = List.of(
                () -> OpSchemaRegistry.newSchema(first, "first.java", 1),
                () -> OpSchemaRegistry.newSchema(second, "second.java", 2));

            OpSchemaRegistry.ProviderLoad load = OpSchemaRegistry.ProviderLoad.run(providers);

            assertNull(load.failure());
            load.rethrowIfFailed();
            assertTrue(OpSchemaRegistry.isRegistered(first));
            assertTrue(OpSchemaRegistry.isRegistered(second));
        }

        @Test
        @DisplayName("A failing provider stops loading and its error is rethrown on every call")
        void failingProviderRethrowsOriginalError() {
            String name = uniqueName("Clash");
            String skipped = uniqueName("Skipped");
            OpSchemaRegistry.newSchema(name, "manual.java", 3);
            List<OpSchemaProvider> providers = List.of(
                () -> OpSchemaRegistry.newSchema(name, "provider.java", 9),
                () -> OpSchemaRegistry.newSchema(skipped, "later.java", 1));

            OpSchemaRegistry.ProviderLoad load = OpSchemaRegistry.ProviderLoad.run(providers);

            DuplicateSchemaError first = assertThrows(DuplicateSchemaError.class, load::rethrowIfFailed);
            DuplicateSchemaError again = assertThrows(DuplicateSchemaError.class, load::rethrowIfFailed);
            assertSame(first, again);
            assertEquals("manual.java", first.existingFile());
            assertFalse(OpSchemaRegistry.isRegistered(skipped));
        }

        @Test
        void skippedLoadNeverFails() {
            assertNull(OpSchemaRegistry.ProviderLoad.SKIPPED.failure());
            OpSchemaRegistry.ProviderLoad.SKIPPED.rethrowIfFailed();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Directly built schemas log verification at the registry's level")
        void directSchemaSharesRegistryLevel() {
            OpSchema registered = OpSchemaRegistry.newSchema(uniqueName("Level"), "level.java", 1);
            OpSchema direct = new OpSchema("Direct", "direct.java", 1);

            assertEquals(OpSchemaRegistry.config().verifyLogLevel(), direct.verifyLogLevel());
            assertEquals(registered.verifyLogLevel(), direct.verifyLogLevel());
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Unknown names are absent, not an error")
        void unknownIsEmpty() {
            assertTrue(OpSchemaRegistry.schema(uniqueName("Missing")).isEmpty());
            assertFalse(OpSchemaRegistry.isRegistered(uniqueName("Missing")));
        }

        @Test
        void keysAreSortedAndIncludeRegistrations() {
            String name = uniqueName("Keys");
            OpSchemaRegistry.newSchema(name, "keys.java", 1);

            List<String> keys = OpSchemaRegistry.keys();
            assertTrue(keys.contains(name));
            assertEquals(keys.stream().sorted().toList(), keys);
        }

        @Test
        @DisplayName("schemas() is read-only")
        void schemasReadOnly() {
            assertThrows(UnsupportedOperationException.class,
                () -> OpSchemaRegistry.schemas().put("Injected", new OpSchema("Injected")));
            assertThrows(UnsupportedOperationException.class,
                () -> OpSchemaRegistry.keys().add("Injected"));
        }
    }

    @Nested
    @DisplayName("Device inference helper")
    class DeviceHelper {

        @Test
        void delegatesToSchema() {
            String name = uniqueName("Gather");
            OpSchemaRegistry.register(name)
                .deviceInferenceFunction(def -> new DevicePlacement(
                    List.of(DeviceOption.nvidia(0), DeviceOption.cpu()),
                    List.of(DeviceOption.nvidia(0))));

            OperatorDef def = OperatorDef.builder(name).inputs("data", "indices").output("out").build();
            DevicePlacement placement = OpSchemaRegistry.inferOpInputOutputDevice(def);

            assertEquals(DeviceOption.cpu(), placement.inputDevice(1));
            assertEquals(DeviceOption.nvidia(0), placement.outputDevice(0));
        }

        @Test
        void usesOperatorDeviceByDefault() {
            String name = uniqueName("Relu");
            OpSchemaRegistry.register(name);

            OperatorDef def = OperatorDef.builder(name).input("x").output("y")
                .device(DeviceOption.amd(1)).build();
            DevicePlacement placement = OpSchemaRegistry.inferOpInputOutputDevice(def);

            assertEquals(List.of(DeviceOption.amd(1)), placement.inputDevices());
            assertEquals(List.of(DeviceOption.amd(1)), placement.outputDevices());
        }

        @Test
        @DisplayName("Unregistered operator types fail")
        void unregisteredFails() {
            String name = uniqueName("Nope");
            OperatorDef def = OperatorDef.builder(name).input("x").output("y").build();

            var ex = assertThrows(SchemaNotFoundException.class,
                () -> OpSchemaRegistry.inferOpInputOutputDevice(def));
            assertEquals(name, ex.operatorType());
            assertTrue(ex.getMessage().contains("No schema for: " + name));
        }
    }

    @Test
    @DisplayName("End to end: Sum-like schema verifies and infers")
    void endToEndSumLike() {
        String name = uniqueName("SumLike");
        OpSchemaRegistry.register(name)
            .numInputs(1, Integer.MAX_VALUE)
            .numOutputs(1)
            .allowInplace(Set.of(InplacePair.of(0, 0)))
            .identicalTypeAndShapeOfInput(0);

        OpSchema schema = OpSchemaRegistry.schema(name).orElseThrow();

        OperatorDef three = OperatorDef.builder(name).inputs("a", "b", "c").output("s").build();
        OperatorDef none = OperatorDef.builder(name).output("s").build();
        OperatorDef inplace = OperatorDef.builder(name).inputs("a", "b").output("a").build();
        assertTrue(schema.verify(three));
        assertFalse(schema.verify(none));
        assertTrue(schema.verify(inplace));

        TensorShape v4 = TensorShape.of(ScalarType.F32, 4);
        assertEquals(List.of(v4), schema.inferTensor(three, List.of(v4, v4, v4)));
    }
}
