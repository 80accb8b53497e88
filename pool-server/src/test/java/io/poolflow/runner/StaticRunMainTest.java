package io.poolflow.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
public class StaticRunMainTest {
    private static int run(Path jobs, ByteArrayOutputStream buf, String... extra) {
        StaticRunMain main = new StaticRunMain();
        main.out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        String[] args = new String[extra.length + 1];
        System.arraycopy(extra, 0, args, 0, extra.length);
        args[extra.length] = jobs.toString();
        return new CommandLine(main).execute(args);
    }

    @Test
    void runs_all_jobs_and_exits_zero() throws Exception {
        Path dir = Files.createTempDirectory("static-run");
        Path jobs = dir.resolve("jobs.txt");
        Files.write(jobs, List.of("# two jobs that cannot overlap", "1M true", "1M echo second"));
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        assertEquals(0, run(jobs, buf, "--capacity", "1M", "--output", dir.resolve("status.txt").toString()));
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Pool review"));
        assertTrue(out.contains("COMPLETED"));
        assertTrue(Files.readString(dir.resolve("status.txt")).contains("End of pool"));
    }

    @Test
    void exits_one_when_a_job_fails_or_is_rejected() throws Exception {
        Path dir = Files.createTempDirectory("static-run");
        Path jobs = dir.resolve("jobs.txt");
        Files.write(jobs, List.of("1K false", "10G true"));
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        assertEquals(1, run(jobs, buf, "-c", "1M", "-l", dir.resolve("logs").toString(), "-o", dir.resolve("status.txt").toString()));
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("FAILED"));
        assertTrue(out.contains("REJECTED"));
    }
}
