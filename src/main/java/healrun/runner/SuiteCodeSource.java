package healrun.runner;

import healrun.model.Suite;

import java.io.IOException;

/** Supplies the compiled, runnable code for a scheduled suite. */
@FunctionalInterface
public interface SuiteCodeSource {

    /**
     * @return the suite's code, or {@code null}/blank if none was built for it
     */
    String codeFor(Suite suite) throws IOException;
}
