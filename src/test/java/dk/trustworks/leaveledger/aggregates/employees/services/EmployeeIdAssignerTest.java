package dk.trustworks.leaveledger.aggregates.employees.services;

import dk.trustworks.leaveledger.aggregates.employees.dto.EmployeeIdAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmployeeIdAssigner")
class EmployeeIdAssignerTest {

    private static final Instant START = Instant.parse("2025-03-05T08:00:00Z");

    @InjectMocks
    private EmployeeIdAssigner assigner;

    @Mock
    private EmployeeIdSequencer sequencer;

    @BeforeEach
    void setUp() {
        assigner.clock = Clock.fixed(START, ZoneOffset.UTC);
    }

    private void advance(Duration duration) {
        assigner.clock = Clock.offset(assigner.clock, duration);
    }

    @Test
    @DisplayName("a second call inside the interval is skipped")
    void throttled() {
        when(sequencer.assign()).thenReturn(new EmployeeIdAssignment(true, 2, 0));

        EmployeeIdAssignment first = assigner.ensureEmployeeIds();
        advance(Duration.ofMinutes(4));
        EmployeeIdAssignment second = assigner.ensureEmployeeIds();

        assertTrue(first.ran());
        assertFalse(second.ran());
        verify(sequencer, times(1)).assign();
    }

    @Test
    @DisplayName("runs again once the interval has passed")
    void afterInterval() {
        when(sequencer.assign()).thenReturn(new EmployeeIdAssignment(true, 0, 0));

        assigner.ensureEmployeeIds();
        advance(Duration.ofMinutes(5));
        assigner.ensureEmployeeIds();

        verify(sequencer, times(2)).assign();
    }

    @Test
    @DisplayName("force ignores the interval")
    void forced() {
        when(sequencer.assign()).thenReturn(new EmployeeIdAssignment(true, 0, 0));

        assigner.ensureEmployeeIds();
        assigner.ensureEmployeeIds(true);

        verify(sequencer, times(2)).assign();
    }

    @Test
    @DisplayName("a failed run propagates and still counts for the throttle")
    void failure() {
        when(sequencer.assign()).thenThrow(new IllegalStateException("Duplicate entry"));

        assertThrows(IllegalStateException.class, () -> assigner.ensureEmployeeIds());
        assertFalse(assigner.ensureEmployeeIds().ran());
    }

    @Test
    @DisplayName("a caller arriving during a run joins it instead of starting another")
    void concurrentCallersShareRun() throws Exception {
        // Given a run blocked inside the sequencer
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sequencer.assign()).thenAnswer(inv -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return new EmployeeIdAssignment(true, 1, 0);
        });
        AtomicReference<EmployeeIdAssignment> firstResult = new AtomicReference<>();
        AtomicReference<EmployeeIdAssignment> secondResult = new AtomicReference<>();
        Thread owner = new Thread(() -> firstResult.set(assigner.ensureEmployeeIds()));
        owner.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When a forced caller arrives while the run is in flight
        Thread joiner = new Thread(() -> secondResult.set(assigner.ensureEmployeeIds(true)));
        joiner.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (joiner.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        release.countDown();
        owner.join(5000);
        joiner.join(5000);

        // Then
        verify(sequencer, times(1)).assign();
        assertEquals(1, firstResult.get().assigned());
        assertEquals(firstResult.get(), secondResult.get());
    }
}
