package com.questrail.cabin.advisor.internal.exec;

import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.internal.events.SessionTimerEvent;
import com.questrail.cabin.advisor.time.DeterministicScheduler;
import com.questrail.cabin.advisor.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BreakReminderSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<AdvisorEvent> events;
    private BreakReminderScheduler reminder;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        events = new ArrayList<>();
        reminder = new BreakReminderScheduler(scheduler, clock, Duration.ofSeconds(200), events::add, () -> T0);
    }

    @Test
    void firesAfterDelay() {
        assertTrue(reminder.arm());
        assertEquals(BreakReminderScheduler.State.ARMED, reminder.state());

        clock.advance(Duration.ofSeconds(199));
        scheduler.runDueTasks();
        assertTrue(events.isEmpty());

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();
        assertEquals(1, events.size());
        assertInstanceOf(SessionTimerEvent.BreakReminderDue.class, events.get(0));
    }

    @Test
    void armingTwiceSchedulesOnce() {
        assertTrue(reminder.arm());
        assertFalse(reminder.arm());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void tryFireSucceedsExactlyOnce() {
        reminder.arm();
        assertTrue(reminder.tryFire());
        assertFalse(reminder.tryFire());
        assertEquals(BreakReminderScheduler.State.FIRED, reminder.state());
    }

    @Test
    void tryFireFailsWhenNotArmed() {
        assertFalse(reminder.tryFire());
    }

    @Test
    void cancelPreventsExpiryAndFiring() {
        reminder.arm();
        reminder.cancel();

        clock.advance(Duration.ofSeconds(300));
        scheduler.runDueTasks();

        assertTrue(events.isEmpty());
        assertFalse(reminder.tryFire());
        assertEquals(BreakReminderScheduler.State.CANCELLED, reminder.state());
        assertFalse(reminder.arm());
    }

    @Test
    void cancelAfterFiringKeepsFiredState() {
        reminder.arm();
        reminder.tryFire();
        reminder.cancel();
        assertEquals(BreakReminderScheduler.State.FIRED, reminder.state());
    }
}
