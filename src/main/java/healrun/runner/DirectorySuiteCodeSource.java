package healrun.runner;

import healrun.model.Suite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@code <dir>/<suite name><extension>}, e.g. {@code generated/ui-products.py}. */
public class DirectorySuiteCodeSource implements SuiteCodeSource {

    private final Path dir;
    private final String extension;

    public DirectorySuiteCodeSource(Path dir, String extension) {
        this.dir = dir;
        this.extension = extension == null ? "" : extension;
    }

    @Override
    public String codeFor(Suite suite) throws IOException {
        Path file = dir.resolve(suite.name() + extension);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return dir + "/*" + extension;
    }
}
