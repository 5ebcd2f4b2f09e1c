package ch.bergturbenthal.cura.libs.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

public class ExternalProcessRunnerTest {
    private String sleepCommand;

    @BeforeEach
    public void findSleep() {
        sleepCommand = List.of("/bin/sleep", "/usr/bin/sleep").stream()
                .filter(candidate -> Files.isExecutable(Path.of(candidate))).findFirst().orElse(null);
        Assumptions.assumeTrue(sleepCommand != null, "sleep is not installed");
    }

    private static boolean waitForChildren(final boolean expectRunning) throws InterruptedException {
        final long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (System.nanoTime() < deadline) {
            if (ProcessHandle.current().children().anyMatch(ProcessHandle::isAlive) == expectRunning)
                return true;
            Thread.sleep(20);
        }
        return false;
    }

    @Test
    public void testCollectsExitCode() throws Exception {
        final ExternalProcessRunner.ExecuteResult result = ExternalProcessRunner
                .execute(new String[] { sleepCommand, "0" }, Duration.ofSeconds(10));
        Assertions.assertEquals(0, result.getCode());
        Assertions.assertEquals(0, result.getStdOut().length);
    }

    @Test
    public void testTimeoutKillsProcess() throws Exception {
        final long startTime = System.nanoTime();
        Assertions.assertThrows(TimeoutException.class,
                () -> ExternalProcessRunner.execute(new String[] { sleepCommand, "30" }, Duration.ofMillis(200)));
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - startTime).compareTo(Duration.ofSeconds(5)) < 0);
        Assertions.assertTrue(waitForChildren(false), "sleep still running after timeout");
    }

    @Test
    public void testInterruptKillsProcess() throws Exception {
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread caller = new Thread(() -> {
            try {
                ExternalProcessRunner.execute(new String[] { sleepCommand, "30" }, Duration.ofMinutes(1));
            } catch (Exception e) {
                failure.set(e);
            }
        }, "process-caller");
        caller.start();
        Assertions.assertTrue(waitForChildren(true), "sleep did not start");

        final long startTime = System.nanoTime();
        caller.interrupt();
        caller.join(Duration.ofSeconds(5).toMillis());

        Assertions.assertFalse(caller.isAlive());
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - startTime).compareTo(Duration.ofSeconds(5)) < 0);
        Assertions.assertTrue(failure.get() instanceof InterruptedException);
        Assertions.assertTrue(waitForChildren(false), "sleep still running after interrupt");
    }
}
