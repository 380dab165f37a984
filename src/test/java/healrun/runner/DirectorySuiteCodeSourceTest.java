package healrun.runner;

import healrun.model.Suite;
import healrun.model.TestCase;
import healrun.model.TestCategory;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DirectorySuiteCodeSourceTest {

    private static Suite suite(String name) {
        return new Suite(name, List.of(new TestCase("c", TestCategory.FUNCTIONAL, "/", List.of())), 1);
    }

    @Test(description = "Reads <dir>/<suite><ext> and returns null when absent")
    public void testCodeFor() throws Exception {
        Path dir = Files.createTempDirectory("code");
        Path file = dir.resolve("ui-root.py");
        try {
            Files.writeString(file, "def test_home():\n    assert True\n");
            DirectorySuiteCodeSource source = new DirectorySuiteCodeSource(dir, ".py");

            assertThat(source.codeFor(suite("ui-root"))).startsWith("def test_home()");
            assertThat(source.codeFor(suite("api-tests"))).isNull();
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }
}
