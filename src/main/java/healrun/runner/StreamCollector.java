package healrun.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Drains one process output stream on its own daemon thread so the child
 * never blocks on a full pipe. The text read so far is available at any time,
 * which keeps partial output after a timeout or cancel.
 */
final class StreamCollector {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    private final InputStream in;
    private final StringBuilder buffer = new StringBuilder();
    private final Thread thread;

    StreamCollector(InputStream in, String threadName) {
        this.in = in;
        this.thread = new Thread(this::drain, threadName);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    private void drain() {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                synchronized (buffer) {
                    buffer.append(buf, 0, n);
                }
            }
        } catch (IOException e) {
            // Stream closed underneath us after the process was killed
            log.debug("[{}] stopped reading: {}", thread.getName(), e.getMessage());
        }
    }

    /** Waits up to {@code millis} for end-of-stream. */
    boolean join(long millis) throws InterruptedException {
        thread.join(millis);
        return !thread.isAlive();
    }

    String snapshot() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }
}
