package healrun.runner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the external test-runner invocation:
 * {@code <runner> <artifact> [<verbose-flag>] [<parallel-flag> <workers>]}.
 * The parallel pair is only added when {@code workers > 1}.
 */
public final class RunnerCommand {

    private final List<String> runner;
    private final String verboseFlag;
    private final String parallelFlag;

    /**
     * @param runner       executable plus fixed leading arguments, e.g. {@code [python, -m, pytest]}
     * @param verboseFlag  verbose flag, or {@code null}/blank for none
     * @param parallelFlag flag that takes the worker count
     */
    public RunnerCommand(List<String> runner, String verboseFlag, String parallelFlag) {
        if (runner == null || runner.isEmpty()) {
            throw new IllegalArgumentException("Runner command must not be empty");
        }
        if (parallelFlag == null || parallelFlag.isBlank()) {
            throw new IllegalArgumentException("Parallel flag must not be blank");
        }
        this.runner = List.copyOf(runner);
        this.verboseFlag = verboseFlag == null || verboseFlag.isBlank() ? null : verboseFlag.trim();
        this.parallelFlag = parallelFlag.trim();
    }

    public static RunnerCommand fromConfig(RunnerConfig config) {
        return new RunnerCommand(config.getRunnerCommand(), config.getVerboseFlag(), config.getParallelFlag());
    }

    public List<String> build(Path artifact, int workers) {
        List<String> cmd = new ArrayList<>(runner);
        cmd.add(artifact.toString());
        if (verboseFlag != null) {
            cmd.add(verboseFlag);
        }
        if (workers > 1) {
            cmd.add(parallelFlag);
            cmd.add(String.valueOf(workers));
        }
        return cmd;
    }

    @Override
    public String toString() {
        return String.join(" ", runner);
    }
}
