package com.openforge.ariste.tool.builtin;

import com.openforge.ariste.tool.ToolExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;

import static com.openforge.ariste.testsupport.ScriptedChatClientFactory.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BashToolTest {

    @TempDir
    Path workDir;

    private BashTool tool;

    @BeforeEach
    void setUp() {
        tool = new BashTool(workDir);
    }

    @AfterEach
    void tearDown() {
        tool.shutdown();
    }

    @Test
    void execute_returnsStdoutOnSuccess() throws ToolExecutionException {
        assertEquals("hello\n", tool.execute(json("{\"command\":\"echo hello\"}")));
    }

    @Test
    void execute_runsInWorkingDirectory() throws Exception {
        Files.writeString(workDir.resolve("marker.txt"), "");
        assertEquals("marker.txt\n", tool.execute(json("{\"command\":\"ls\"}")));
    }

    @Test
    void execute_reportsStderrOnFailure() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(json("{\"command\":\"echo broken >&2; exit 3\"}")));
        assertEquals("broken\n", e.getMessage());
    }

    @Test
    void execute_reportsExitCodeWhenStderrEmpty() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(json("{\"command\":\"exit 4\"}")));
        assertEquals("Command failed with exit code: 4", e.getMessage());
    }

    @Test
    void execute_killsCommandAfterTimeout() {
        BashTool shortLived = new BashTool(workDir, Duration.ofSeconds(1));
        try {
            ToolExecutionException e = assertThrows(ToolExecutionException.class,
                    () -> shortLived.execute(json("{\"command\":\"sleep 10\"}")));
            assertEquals("Command timed out after 1 seconds", e.getMessage());
        } finally {
            shortLived.shutdown();
        }
    }

    @Test
    void execute_requiresCommand() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class, () -> tool.execute(json("{}")));
        assertEquals("Missing 'command' argument", e.getMessage());
    }

    @Test
    void execute_drainsLargeStderrWhileCommonPoolIsBusy() throws Exception {
        BashTool bounded = new BashTool(workDir, Duration.ofSeconds(10));
        CountDownLatch release = new CountDownLatch(1);
        int parallelism = ForkJoinPool.getCommonPoolParallelism();
        for (int i = 0; i < parallelism; i++) {
            ForkJoinPool.commonPool().execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        try {
            String out = bounded.execute(json(
                    "{\"command\":\"head -c 200000 /dev/zero | tr '\\\\0' x >&2; echo ok\"}"));
            assertEquals("ok\n", out);
        } finally {
            release.countDown();
            bounded.shutdown();
        }
    }
}
