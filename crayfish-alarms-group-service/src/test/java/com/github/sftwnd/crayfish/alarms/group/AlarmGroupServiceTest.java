package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import com.github.sftwnd.crayfish.alarms.registry.ConcurrencyFailureException;
import com.github.sftwnd.crayfish.alarms.registry.InvalidAlarmException;
import com.github.sftwnd.crayfish.alarms.registry.WorkerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;

class AlarmGroupServiceTest {

    private static final Duration INTERVAL = Duration.ofMillis(50);
    private static final long WAIT = 2000;

    private IAlarmListener listener;
    private AlarmGroupService service;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    @BeforeEach
    void startUp() {
        listener = Mockito.mock(IAlarmListener.class);
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
        assertNull(failure.get(), "service threads must not fail");
    }

    @Test
    void singleAlarmCreatesWorkerTest() {
        service = service(null, null);
        service.start();
        Alarm alarm = service.registerAlarm(1, 3, 10, "Meeting");
        ArgumentCaptor<WorkerHandle> worker = ArgumentCaptor.forClass(WorkerHandle.class);
        Mockito.verify(listener, timeout(WAIT)).workerCreated(worker.capture(), any());
        assertEquals(3, worker.getValue().getGroupId(), "worker has to be created for the alarm group");
        assertEquals(WorkerStatus.ACTIVE, service.workerStatus(3), "group with alarm has to be ACTIVE");
        assertEquals(List.of(alarm.getId()), service.registry().snapshotByGroup(3).stream().map(Alarm::getId).collect(Collectors.toList()), "alarm has to be registered");
    }

    @Test
    void sameGroupKeepsSingleWorkerTest() throws InterruptedException {
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 3, 10, "first");
        Mockito.verify(listener, timeout(WAIT)).workerCreated(any(), any());
        service.registerAlarm(2, 3, 20, "second");
        Thread.sleep(200);
        Mockito.verify(listener, times(1)).workerCreated(any(), any());
        assertEquals(1, service.lastWorkerId(), "second alarm of the group must not create a worker");
        assertEquals(1, service.activeWorkers().size(), "group has to be served by one worker");
        List<GroupView> views = service.viewAlarms();
        assertEquals(1, views.size(), "one group has to be viewed");
        assertEquals(2, views.get(0).getAlarms().size(), "both alarms have to be assigned to the worker");
    }

    @Test
    void outOfRangeGroupTest() throws InterruptedException {
        service = service(null, null);
        service.start();
        assertThrows(InvalidAlarmException.class, () -> service.registerAlarm(1, 300, 10, "x"), "Group(300) has to be rejected");
        Thread.sleep(200);
        assertTrue(service.registry().isEmpty(), "rejected alarm must not be registered");
        assertTrue(service.activeWorkers().isEmpty(), "rejected alarm must not create workers");
        Mockito.verify(listener, never()).workerCreated(any(), any());
    }

    @Test
    void emptyGroupReleasesWorkerTest() {
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 3, 10, "first");
        service.registerAlarm(2, 3, 20, "second");
        ArgumentCaptor<WorkerHandle> worker = ArgumentCaptor.forClass(WorkerHandle.class);
        Mockito.verify(listener, timeout(WAIT)).workerCreated(worker.capture(), any());
        service.registry().remove(1);
        service.registry().remove(2);
        Mockito.verify(listener, timeout(WAIT)).workerRemoved(worker.getValue());
        assertEquals(WorkerStatus.INACTIVE, service.workerStatus(3), "group without alarms has to be INACTIVE");
        assertTrue(worker.getValue().isTerminated(), "worker of the empty group has to be terminated");
        assertTrue(service.activeWorkers().isEmpty(), "there must be no active workers");
    }

    @Test
    void groupReactivationTest() {
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 8, 10, "first");
        Mockito.verify(listener, timeout(WAIT)).workerCreated(any(), any());
        service.registry().remove(1);
        Mockito.verify(listener, timeout(WAIT)).workerRemoved(any());
        service.registerAlarm(2, 8, 10, "again");
        ArgumentCaptor<WorkerHandle> worker = ArgumentCaptor.forClass(WorkerHandle.class);
        Mockito.verify(listener, timeout(WAIT).times(2)).workerCreated(worker.capture(), any());
        assertEquals(2, worker.getValue().getWorkerId(), "released group has to get a new worker");
    }

    @Test
    void concurrentRegistrationTest() throws InterruptedException {
        service = service(null, null);
        service.start();
        int threads = 50;
        CountDownLatch startCdl = new CountDownLatch(1);
        CountDownLatch doneCdl = new CountDownLatch(threads);
        AtomicBoolean failed = new AtomicBoolean(false);
        Collection<Thread> clients = IntStream.range(0, threads).mapToObj(i -> new Thread(() -> {
            try {
                if (startCdl.await(1, TimeUnit.SECONDS)) {
                    service.registerAlarm(i, i % 10, 10 + i, "Alarm " + i);
                }
            } catch (RuntimeException | InterruptedException ex) {
                failed.set(true);
            } finally {
                doneCdl.countDown();
            }
        })).collect(Collectors.toList());
        clients.forEach(Thread::start);
        startCdl.countDown();
        assertTrue(doneCdl.await(WAIT, TimeUnit.MILLISECONDS), "all registrations have to complete");
        assertFalse(failed.get(), "concurrent registrations have to succeed");
        Mockito.verify(listener, timeout(WAIT).times(10)).workerCreated(any(), any());
        Map<Integer, WorkerHandle> workers = service.activeWorkers();
        assertEquals(10, workers.size(), "every group has to be served");
        assertEquals(10, service.lastWorkerId(), "exactly one worker per group has to be created");
        assertEquals(50, service.registry().size(), "every alarm has to be registered");
    }

    @Test
    void displayTest() {
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 2, 0, "every check");
        Mockito.verify(listener, timeout(WAIT).atLeast(2)).alarmDisplayed(any(), any());
        ArgumentCaptor<Alarm> alarm = ArgumentCaptor.forClass(Alarm.class);
        Mockito.verify(listener, atLeast(2)).alarmDisplayed(any(), alarm.capture());
        assertEquals(1, alarm.getValue().getId(), "due alarm of the group has to be displayed");
    }

    @Test
    void defaultConfigDisplayTest() {
        service = new AlarmGroupService(null, AlarmGroupServiceConfig.load(), listener, null, this::unexpected);
        assertFalse(service.getConfig().isDispatcherEnabled(), "dispatcher has to be disabled by default");
        service.start();
        service.registerAlarm(1, 2, 1, "every second");
        ArgumentCaptor<WorkerHandle> worker = ArgumentCaptor.forClass(WorkerHandle.class);
        Mockito.verify(listener, timeout(4500).atLeast(2)).alarmDisplayed(worker.capture(), any());
        assertEquals(2, worker.getValue().getGroupId(), "alarm has to be displayed by the worker of its group");
        Mockito.verify(listener, never()).alarmExpired(any());
    }

    @Test
    void workerFailureIsFatalTest() throws Exception {
        ConcurrencyFailureException broken = new ConcurrencyFailureException("broken condition");
        AlarmRegistry registry = new AlarmRegistry() {
            @Override
            public List<Alarm> fireDue(int groupId, Instant now) {
                throw broken;
            }
        };
        CompletableFuture<Throwable> fatal = new CompletableFuture<>();
        service = new AlarmGroupService(registry, new AlarmGroupServiceConfig(INTERVAL, false, Duration.ofSeconds(1)), listener, null, fatal::complete);
        service.start();
        service.registerAlarm(1, 3, 10, "first");
        assertSame(broken, fatal.get(WAIT, TimeUnit.MILLISECONDS), "failure of a display worker has to reach the fatal handler");
    }

    @Test
    void listenerFailureTest() {
        Mockito.doThrow(new IllegalStateException("listener failure")).when(listener).alarmDisplayed(any(), any());
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 2, 0, "every check");
        Mockito.verify(listener, timeout(WAIT).atLeast(3)).alarmDisplayed(any(), any());
        assertEquals(WorkerStatus.ACTIVE, service.workerStatus(2), "listener failure must not stop the worker");
    }

    @Test
    void dispatcherTest() {
        service = new AlarmGroupService(null, new AlarmGroupServiceConfig(INTERVAL, true, Duration.ofSeconds(1)), listener, null, this::unexpected);
        service.start();
        service.registry().insert(Alarm.builder().id(1).groupId(4).dueTime(Instant.now().plusMillis(100)).message("once").build());
        ArgumentCaptor<Alarm> alarm = ArgumentCaptor.forClass(Alarm.class);
        Mockito.verify(listener, timeout(WAIT)).alarmExpired(alarm.capture());
        assertEquals(1, alarm.getValue().getId(), "due alarm has to be fired by the dispatcher");
        Mockito.verify(listener, timeout(WAIT)).workerRemoved(any());
        assertTrue(service.registry().isEmpty(), "one-shot alarm has to leave the registry");
    }

    @Test
    void startTwiceTest() {
        service = service(null, null);
        service.start();
        assertTrue(service.isStarted(), "service has to be started");
        assertThrows(IllegalStateException.class, () -> service.start(), "second start has to be rejected");
    }

    @Test
    void closeTest() {
        service = service(null, null);
        service.start();
        service.registerAlarm(1, 1, 10, "first");
        ArgumentCaptor<WorkerHandle> worker = ArgumentCaptor.forClass(WorkerHandle.class);
        Mockito.verify(listener, timeout(WAIT)).workerCreated(worker.capture(), any());
        service.close();
        assertTrue(worker.getValue().isTerminated(), "close has to stop the workers");
        assertTrue(service.activeWorkers().isEmpty(), "closed service has no active workers");
        assertDoesNotThrow(service::close, "second close has to be ignored");
        assertThrows(IllegalStateException.class, () -> service.start(), "closed service must not be started");
    }

    @Test
    void spawnFailureRetryTest() {
        AtomicInteger calls = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            if (calls.getAndIncrement() == 0) {
                throw new IllegalStateException("no threads");
            }
            return new Thread(runnable);
        };
        service = service(threadFactory, null);
        service.start();
        service.registerAlarm(1, 5, 10, "first");
        Mockito.verify(listener, timeout(WAIT)).workerSpawnFailed(eq(5), any(IllegalStateException.class));
        service.registerAlarm(2, 6, 10, "second");
        Mockito.verify(listener, timeout(WAIT).times(2)).workerCreated(any(), any());
        assertEquals(WorkerStatus.ACTIVE, service.workerStatus(5), "failed group has to be served after retry");
        assertEquals(WorkerStatus.ACTIVE, service.workerStatus(6), "new group has to be served");
        Mockito.verify(listener, times(1)).workerSpawnFailed(anyInt(), any());
    }

    @Test
    void fatalFailureTest() throws Exception {
        ConcurrencyFailureException brokenLock = new ConcurrencyFailureException("broken lock");
        CompletableFuture<Throwable> fatal = new CompletableFuture<>();
        service = service(runnable -> { throw brokenLock; }, fatal::complete);
        service.start();
        service.registerAlarm(1, 5, 10, "first");
        assertSame(brokenLock, fatal.get(WAIT, TimeUnit.MILLISECONDS), "concurrency failure has to reach the fatal handler");
        Mockito.verify(listener, never()).workerSpawnFailed(anyInt(), any());
    }

    private AlarmGroupService service(ThreadFactory threadFactory, Consumer<Throwable> fatalHandler) {
        AlarmGroupServiceConfig config = new AlarmGroupServiceConfig(INTERVAL, false, Duration.ofSeconds(1));
        return new AlarmGroupService(null, config, listener, threadFactory, fatalHandler == null ? this::unexpected : fatalHandler);
    }

    private void unexpected(Throwable throwable) {
        failure.compareAndSet(null, throwable);
    }

}
