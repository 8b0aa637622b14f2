package com.ryuqq.railway.core.step;

import com.ryuqq.railway.core.workflow.WorkflowException;
import com.ryuqq.railway.core.workflow.fixture.AddPrefix;
import com.ryuqq.railway.core.workflow.fixture.Greeter;
import com.ryuqq.railway.core.workflow.fixture.Prefix;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepRegistryTest {

    private static final DependencyResolver PREFIX_ONLY = (Type type) -> {
        if (type == Prefix.class) {
            return new Prefix(">> ");
        }
        throw new WorkflowException("Could not find type: (" + type.getTypeName() + ").");
    };

    @Test
    void create_WithoutFactory_InjectsConstructorArguments() throws Exception {
        // When
        AddPrefix step = new StepRegistry().create(AddPrefix.class, PREFIX_ONLY);

        // Then
        assertEquals(">> x", step.run("x"));
    }

    @Test
    void create_WithRegisteredFactory_UsesFactory() throws Exception {
        // Given
        StepRegistry registry = new StepRegistry()
            .register(AddPrefix.class, dependencies -> new AddPrefix(new Prefix("factory: ")));

        // When
        AddPrefix step = registry.create(AddPrefix.class, PREFIX_ONLY);

        // Then
        assertTrue(registry.isRegistered(AddPrefix.class));
        assertEquals("factory: x", step.run("x"));
    }

    @Test
    void register_Twice_ThrowsIllegalStateException() {
        // Given
        StepRegistry registry = new StepRegistry()
            .register(AddPrefix.class, dependencies -> new AddPrefix(new Prefix("")));

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> registry.register(AddPrefix.class, dependencies -> new AddPrefix(new Prefix(""))));
    }

    @Test
    void create_WhenFactoryReturnsNull_ThrowsWorkflowException() {
        // Given
        StepRegistry registry = new StepRegistry().register(AddPrefix.class, dependencies -> null);

        // When & Then
        assertThrows(WorkflowException.class, () -> registry.create(AddPrefix.class, PREFIX_ONLY));
    }

    @Test
    void create_InterfaceWithoutFactory_ThrowsWorkflowException() {
        // When & Then
        WorkflowException exception = assertThrows(WorkflowException.class,
            () -> new StepRegistry().create(Greeter.class, PREFIX_ONLY));
        assertTrue(exception.getMessage().contains("is abstract"));
    }

    @Test
    void create_WhenDependencyMissing_PropagatesResolverError() {
        // Given
        DependencyResolver empty = type -> {
            throw new WorkflowException("Could not find type: (" + type.getTypeName() + ").");
        };

        // When & Then
        WorkflowException exception = assertThrows(WorkflowException.class,
            () -> new StepRegistry().create(AddPrefix.class, empty));
        assertTrue(exception.getMessage().contains("Prefix"));
    }
}
