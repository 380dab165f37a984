package healrun.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Force-kills a process together with every process it spawned. */
final class ProcessTrees {

    private static final Logger log = LoggerFactory.getLogger(ProcessTrees.class);

    /** Children forked while a kill round is in progress are picked up by the next round. */
    private static final int MAX_ROUNDS = 3;

    private ProcessTrees() {}

    /**
     * Kills {@code root} and its descendants, then waits up to {@code grace}
     * for all of them to exit.
     *
     * @return true if every killed process has exited
     */
    static boolean destroy(ProcessHandle root, Duration grace) {
        List<ProcessHandle> killed = new ArrayList<>();
        for (int round = 0; round < MAX_ROUNDS; round++) {
            // Snapshot before killing the root: orphans are reparented and drop out of descendants()
            List<ProcessHandle> tree = root.descendants().filter(ProcessHandle::isAlive).toList();
            if (tree.isEmpty() && !root.isAlive()) {
                break;
            }
            tree.forEach(ProcessHandle::destroyForcibly);
            root.destroyForcibly();
            killed.addAll(tree);
        }
        killed.add(root);

        long deadline = System.nanoTime() + grace.toNanos();
        boolean allExited = true;
        for (ProcessHandle p : killed) {
            long remaining = deadline - System.nanoTime();
            try {
                p.onExit().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                allExited = false;
                log.warn("Process {} did not exit within {} ms of being killed", p.pid(), grace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                log.warn("Waiting for process {} failed: {}", p.pid(), e.getMessage());
                allExited = false;
            }
        }
        log.debug("Killed process tree of {} ({} process(es))", root.pid(), killed.size());
        return allExited;
    }
}
