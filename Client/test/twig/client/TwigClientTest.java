package twig.client;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import twig.core.suite.FunSuite;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

public class TwigClientTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testPassingRun() throws IOException, InterruptedException {
        File configuration = writeConfiguration("{ \"suites\": [\"" + PassingSuite.class.getName() + "\"], \"num_threads\": 2 }");
        Assert.assertEquals(0, TwigClient.run(new String[]{ configuration.getAbsolutePath() }));
    }

    @Test
    public void testFailingRun() throws IOException, InterruptedException {
        File configuration = writeConfiguration("{ \"suites\": [\"" + PassingSuite.class.getName() + "\", \"" + FailingSuite.class.getName() + "\"] }");
        Assert.assertEquals(1, TwigClient.run(new String[]{ configuration.getAbsolutePath() }));
    }

    @Test
    public void testExcludedFailingTestPasses() throws IOException, InterruptedException {
        File configuration = writeConfiguration("{ \"suites\": [\"" + FailingSuite.class.getName() + "\"], \"exclude_tags\": [\"broken\"] }");
        Assert.assertEquals(0, TwigClient.run(new String[]{ configuration.getAbsolutePath() }));
    }

    @Test
    public void testUnknownSuiteFailsRun() throws IOException, InterruptedException {
        File configuration = writeConfiguration("{ \"suites\": [\"twig.client.NoSuchSuite\"] }");
        Assert.assertEquals(1, TwigClient.run(new String[]{ configuration.getAbsolutePath() }));
    }

    @Test
    public void testInvalidConfigurationFailsRun() throws IOException, InterruptedException {
        File configuration = writeConfiguration("{ \"suites\": 3 }");
        Assert.assertEquals(1, TwigClient.run(new String[]{ configuration.getAbsolutePath() }));
    }

    @Test
    public void testWrongArgumentCount() throws IOException, InterruptedException {
        Assert.assertEquals(1, TwigClient.run(new String[0]));
        Assert.assertEquals(1, TwigClient.run(new String[]{ "a", "b" }));
    }

    private File writeConfiguration(String document) throws IOException {
        File file = this.folder.newFile("run.json");
        Files.write(file.toPath(), document.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    public static class PassingSuite extends FunSuite {
        public PassingSuite() {
            test("passes", () -> Assert.assertTrue(true));
        }
    }

    public static class FailingSuite extends FunSuite {
        public FailingSuite() {
            test("passes", () -> {});
            test("fails", Collections.singleton("broken"), () -> Assert.fail("expected failure"));
        }
    }
}
