package dtm.graph.common;

import dtm.graph.annotations.Embeddable;
import dtm.graph.prototypes.FieldKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for type identity, shape and assignability checks.
 */
class TypeDescriptorTest {

    @Test
    void descriptorsOfSameTypeAreEqual() {
        assertThat(TypeDescriptor.of(new Engine())).isEqualTo(TypeDescriptor.ofType(Engine.class));
        assertThat(TypeDescriptor.of(new Engine())).isNotEqualTo(TypeDescriptor.ofType(TurboEngine.class));
    }

    @Test
    void ordinaryClassInstancesArePointersToRecords() {
        assertThat(TypeDescriptor.of(new Engine()).isPointerToRecord()).isTrue();
        assertThat(TypeDescriptor.of(new Settings()).isPointerToRecord()).isTrue();
    }

    @Test
    void valuesAndContainersAreNotPointersToRecords() {
        Supplier<String> lambda = () -> "x";

        assertThat(TypeDescriptor.of("text").isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(42).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(Boolean.TRUE).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(TimeUnit.SECONDS).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(new int[0]).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(new ArrayList<>()).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(new HashMap<>()).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(new Object()).isPointerToRecord()).isFalse();
        assertThat(TypeDescriptor.of(lambda).isPointerToRecord()).isFalse();
    }

    @Test
    void assignabilityCoversExactTypesSupertypesAndInterfaces() {
        TypeDescriptor turbo = TypeDescriptor.of(new TurboEngine());

        assertThat(turbo.isAssignableTo(TypeDescriptor.ofType(TurboEngine.class))).isTrue();
        assertThat(turbo.isAssignableTo(TypeDescriptor.ofType(Engine.class))).isTrue();
        assertThat(turbo.isAssignableTo(TypeDescriptor.ofType(Motor.class))).isTrue();
        assertThat(TypeDescriptor.of(new Engine()).isAssignableTo(TypeDescriptor.ofType(TurboEngine.class))).isFalse();
    }

    @Test
    void boxedValuesAreAssignableToPrimitiveFields() {
        assertThat(TypeDescriptor.of(8080).isAssignableTo(TypeDescriptor.ofType(int.class))).isTrue();
        assertThat(TypeDescriptor.of(8080L).isAssignableTo(TypeDescriptor.ofType(int.class))).isFalse();
    }

    @Test
    void fieldKindsFollowDeclaredTypes() {
        assertThat(TypeDescriptor.ofType(Engine.class).getFieldKind()).isEqualTo(FieldKind.POINTER);
        assertThat(TypeDescriptor.ofType(Settings.class).getFieldKind()).isEqualTo(FieldKind.RECORD);
        assertThat(TypeDescriptor.ofType(Motor.class).getFieldKind()).isEqualTo(FieldKind.INTERFACE);
        assertThat(TypeDescriptor.ofType(AbstractMotor.class).getFieldKind()).isEqualTo(FieldKind.INTERFACE);
        assertThat(TypeDescriptor.ofType(Map.class).getFieldKind()).isEqualTo(FieldKind.MAP);
        assertThat(TypeDescriptor.ofType(SortedMap.class).getFieldKind()).isEqualTo(FieldKind.MAP);
        assertThat(TypeDescriptor.ofType(HashMap.class).getFieldKind()).isEqualTo(FieldKind.MAP);
        assertThat(TypeDescriptor.ofType(List.class).getFieldKind()).isEqualTo(FieldKind.UNSUPPORTED);
        assertThat(TypeDescriptor.ofType(String.class).getFieldKind()).isEqualTo(FieldKind.UNSUPPORTED);
        assertThat(TypeDescriptor.ofType(int.class).getFieldKind()).isEqualTo(FieldKind.UNSUPPORTED);
        assertThat(TypeDescriptor.ofType(int[].class).getFieldKind()).isEqualTo(FieldKind.UNSUPPORTED);
        assertThat(TypeDescriptor.ofType(TimeUnit.class).getFieldKind()).isEqualTo(FieldKind.UNSUPPORTED);
    }

    // Test fixtures

    interface Motor {
    }

    abstract static class AbstractMotor implements Motor {
    }

    static class Engine implements Motor {
    }

    static class TurboEngine extends Engine {
    }

    @Embeddable
    static class Settings {
        public int retries;
    }
}
