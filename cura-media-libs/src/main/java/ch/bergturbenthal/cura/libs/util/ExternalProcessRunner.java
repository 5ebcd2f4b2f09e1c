package ch.bergturbenthal.cura.libs.util;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external tool, collecting stdout as bytes and stderr as text.
 * <p>
 * The process is killed when the calling thread is interrupted or the timeout expires.
 */
@Slf4j
public class ExternalProcessRunner {

    public static ExecuteResult execute(final String[] cmdarray, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        final long startTime = System.nanoTime();
        final Process process = new ProcessBuilder(cmdarray).start();
        process.getOutputStream().close();
        final ByteArrayOutputStream stdOutBuffer = new ByteArrayOutputStream();
        final StringBuffer stdErrBuffer = new StringBuffer();
        final Thread stdOutReader = new Thread(() -> {
            try (InputStream inputStream = process.getInputStream()) {
                IOUtils.copy(inputStream, stdOutBuffer);
            } catch (IOException e) {
                log.warn("Cannot read stdout of {}", cmdarray[0], e);
            }
        }, "stdout-" + cmdarray[0]);
        final Thread stdErrReader = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                while (true) {
                    final String line = reader.readLine();
                    if (line == null)
                        break;
                    stdErrBuffer.append(line);
                    stdErrBuffer.append('\n');
                    log.debug("STDERR: " + line);
                }
            } catch (IOException e) {
                log.warn("Cannot read stderr of {}", cmdarray[0], e);
            }
        }, "stderr-" + cmdarray[0]);
        stdOutReader.setDaemon(true);
        stdErrReader.setDaemon(true);
        stdOutReader.start();
        stdErrReader.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TimeoutException(cmdarray[0] + " did not finish within " + timeout);
            }
            stdOutReader.join();
            stdErrReader.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            log.info("Killed {} on interrupt", cmdarray[0]);
            throw e;
        }
        final Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
        log.debug("Processed in " + duration + ": " + String.join(" ", cmdarray));
        return new ExecuteResult(process.exitValue(), stdOutBuffer.toByteArray(), stdErrBuffer.toString(), duration);
    }

    @Value
    public static class ExecuteResult {
        int code;
        byte[] stdOut;
        String stdErr;
        Duration duration;
    }
}
