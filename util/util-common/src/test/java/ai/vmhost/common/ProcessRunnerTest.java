package ai.vmhost.common;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.time.Duration;

public class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner(Duration.ofSeconds(5));

    @Test
    public void collectsOutputAndExitCode() throws Exception {
        var result = runner.run("sh", "-c", "echo first; echo second 1>&2; exit 3");

        Assert.assertEquals(3, result.exitCode());
        Assert.assertFalse(result.success());
        Assert.assertTrue(result.output().contains("first"));
        Assert.assertTrue(result.output().contains("second"));
    }

    @Test
    public void checkedRunFailsWithOutput() throws Exception {
        try {
            runner.runChecked("sh", "-c", "echo no such device; exit 1");
            Assert.fail();
        } catch (ProcessRunner.CommandFailedException e) {
            Assert.assertEquals(1, e.result().exitCode());
            Assert.assertTrue(e.getMessage().contains("no such device"));
        }
    }

    @Test
    public void slowCommandIsDestroyed() throws Exception {
        var quick = new ProcessRunner(Duration.ofMillis(200));
        try {
            quick.run("sleep", "10");
            Assert.fail();
        } catch (IOException e) {
            Assert.assertTrue(e.getMessage().contains("timed out"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void emptyCommand() throws Exception {
        runner.run();
    }
}
