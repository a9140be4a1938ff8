package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlarmDispatcherTest {

    private AlarmRegistry registry;
    private List<Alarm> expired;
    private CountDownLatch expiredCdl;
    private AlarmDispatcher dispatcher;
    private Thread thread;

    @BeforeEach
    void startUp() {
        registry = new AlarmRegistry();
        expired = new CopyOnWriteArrayList<>();
        expiredCdl = new CountDownLatch(1);
        dispatcher = new AlarmDispatcher(registry, new IAlarmListener() {
            @Override
            public void alarmExpired(Alarm alarm) {
                expired.add(alarm);
                expiredCdl.countDown();
            }
        });
        thread = new Thread(() -> {
            try {
                dispatcher.dispatchLoop();
            } catch (InterruptedException ignore) {
                Thread.currentThread().interrupt();
            }
        }, "alarm-dispatcher-test");
        thread.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.stop();
        thread.join(1000);
        assertFalse(thread.isAlive(), "dispatcher thread has to stop");
    }

    @Test
    void preemptionTest() throws InterruptedException {
        Instant now = registry.now();
        registry.insert(alarm(1, now.plusSeconds(3), 0));
        Thread.sleep(100);
        registry.insert(alarm(2, now.plusMillis(200), 0));
        assertTrue(expiredCdl.await(1, TimeUnit.SECONDS), "earlier alarm has to fire before the awaited one");
        assertEquals(2, expired.get(0).getId(), "earlier alarm has to be fired first");
        assertFalse(registry.now().isBefore(now.plusMillis(200)), "alarm must not be fired before its dueTime");
        assertEquals(1, registry.size(), "later alarm has to stay in the registry");
        assertEquals(1, registry.snapshot().get(0).getId(), "later alarm has to stay in the registry");
    }

    @Test
    void periodicRequeueTest() throws InterruptedException {
        Instant now = registry.now();
        registry.insert(alarm(1, now.plusMillis(100), 5));
        assertTrue(expiredCdl.await(1, TimeUnit.SECONDS), "alarm has to fire at its dueTime");
        List<Alarm> alarms = registry.snapshot();
        assertEquals(1, alarms.size(), "periodic alarm has to be queued again");
        assertTrue(alarms.get(0).getDueTime().isAfter(now.plusSeconds(5)), "requeued alarm has to be due one period later");
    }

    @Test
    void oneShotTest() throws InterruptedException {
        registry.insert(alarm(1, registry.now().plusMillis(50), 0));
        assertTrue(expiredCdl.await(1, TimeUnit.SECONDS), "alarm has to fire at its dueTime");
        assertTrue(registry.isEmpty(), "zero period alarm has to leave the registry");
    }

    @Test
    void removedAlarmIsNotFiredTest() throws InterruptedException {
        registry.insert(alarm(1, registry.now().plusMillis(300), 0));
        Thread.sleep(50);
        registry.remove(1);
        assertFalse(expiredCdl.await(500, TimeUnit.MILLISECONDS), "removed alarm must not be fired");
        assertTrue(dispatcher.isRunning(), "dispatcher has to keep running");
    }

    private static Alarm alarm(int id, Instant dueTime, int periodSeconds) {
        return Alarm.builder().id(id).groupId(0).periodSeconds(periodSeconds).dueTime(dueTime).message("Alarm " + id).build();
    }

}
