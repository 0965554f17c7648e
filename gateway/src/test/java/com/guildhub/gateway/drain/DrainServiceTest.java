package com.guildhub.gateway.drain;

import com.guildhub.gateway.TestSupport;
import com.guildhub.gateway.TestSupport.TestConnection;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DrainServiceTest {

    private ConnectionRegistry registry;
    private DrainService drainService;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        drainService = new DrainService(registry, TestSupport.metrics(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        registry.dispose();
    }

    @Test
    void testDrainClosesEveryConnection() {
        TestSupport.Connections connections = new TestSupport.Connections();
        TestConnection a = connections.create("alice").drained();
        TestConnection b = connections.create("bob").drained();
        registry.add(a.connection).block();
        registry.add(b.connection).block();

        assertFalse(drainService.isDraining());
        StepVerifier.create(drainService.startDrain()).verifyComplete();

        assertTrue(drainService.isDraining());
        assertTrue(drainService.isDrainComplete());
        assertEquals(0, drainService.getRemainingConnections());
        assertEquals(List.of(CloseCodes.GOING_AWAY), a.transport.closeCodes);
        assertEquals(List.of(CloseCodes.GOING_AWAY), b.transport.closeCodes);
    }

    @Test
    void testSecondDrainIsNoOp() {
        StepVerifier.create(drainService.startDrain()).verifyComplete();
        StepVerifier.create(drainService.startDrain()).verifyComplete();

        assertTrue(drainService.isDrainComplete());
    }

    @Test
    void testNoAdmissionAfterDrain() {
        TestSupport.Connections connections = new TestSupport.Connections();
        StepVerifier.create(drainService.startDrain()).verifyComplete();

        TestConnection late = connections.create("carol").drained();
        StepVerifier.create(registry.add(late.connection))
            .expectNext(false)
            .verifyComplete();

        assertTrue(registry.isAdmissionClosed());
        assertEquals(0, registry.size());
        assertFalse(registry.isOnline("carol"));
    }
}
