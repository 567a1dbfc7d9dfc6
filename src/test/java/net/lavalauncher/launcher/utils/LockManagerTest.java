package net.lavalauncher.launcher.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class LockManagerTest {
    @TempDir
    Path tempDir;

    @Test
    void testLockFileIsNamedAfterKeyHash() throws IOException {
        var lockManager = new LockManager(tempDir.resolve("locks"));
        try (var lock = lockManager.lock("instance-vanilla")) {
            assertThat(tempDir.resolve("locks/_" + HashingUtil.sha1("instance-vanilla") + ".lock")).exists();
        }
    }

    @Test
    void testSameKeyIsExclusive() throws Exception {
        var lockManager = new LockManager(tempDir);
        var acquired = new CountDownLatch(1);
        var executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> waiting;
            try (var lock = lockManager.lock("instance-vanilla")) {
                waiting = executor.submit(() -> {
                    try (var secondLock = lockManager.lock("instance-vanilla")) {
                        acquired.countDown();
                    }
                });
                assertThat(acquired.await(750, TimeUnit.MILLISECONDS)).isFalse();
            }

            assertThat(acquired.await(10, TimeUnit.SECONDS)).isTrue();
            waiting.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testInterruptedWaitReleasesLockFile() throws Exception {
        var lockManager = new LockManager(tempDir);
        var lockFile = tempDir.resolve("_" + HashingUtil.sha1("instance-vanilla") + ".lock");
        var failure = new AtomicReference<Throwable>();
        var stillInterrupted = new AtomicBoolean();

        try (var lock = lockManager.lock("instance-vanilla")) {
            var waiter = new Thread(() -> {
                try (var secondLock = lockManager.lock("instance-vanilla")) {
                    failure.set(new AssertionError("Lock should not have been acquired"));
                } catch (RuntimeException e) {
                    failure.set(e);
                    stillInterrupted.set(Thread.currentThread().isInterrupted());
                }
            });
            waiter.start();
            Thread.sleep(500);
            waiter.interrupt();
            waiter.join(10_000);

            assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
            assertThat(stillInterrupted).isTrue();
            // Only the channel of the lock held by this thread still refers to the file
            assertThat(countOpenDescriptors(lockFile)).isEqualTo(1);
        }
    }

    private static long countOpenDescriptors(Path file) throws IOException {
        var target = file.toRealPath();
        try (var descriptors = Files.list(Path.of("/proc/self/fd"))) {
            return descriptors.filter(fd -> {
                try {
                    return Files.readSymbolicLink(fd).equals(target);
                } catch (IOException e) {
                    // Descriptors closed while listing
                    return false;
                }
            }).count();
        }
    }

    @Test
    void testDifferentKeysDoNotBlock() throws IOException {
        var lockManager = new LockManager(tempDir);
        try (var first = lockManager.lock("instance-a");
             var second = lockManager.lock("instance-b")) {
            assertThat(first).isNotSameAs(second);
        }
    }

    @Test
    void testLockCanBeReacquiredAfterRelease() throws IOException {
        var lockManager = new LockManager(tempDir);
        try (var lock = lockManager.lock("instance-vanilla")) {
            assertThat(lock).isNotNull();
        }
        try (var lock = lockManager.lock("instance-vanilla")) {
            assertThat(lock).isNotNull();
        }
    }
}
