package io.poolflow.runner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobFileTest {
    @Test
    void parses_cost_and_command_skipping_comments() {
        List<JobFile.Entry> jobs = JobFile.parse(List.of(
                "# nightly batch",
                "",
                "2G  ./simulate --grid  fine",
                "   512M echo done"));
        assertEquals(2, jobs.size());
        assertEquals(3, jobs.get(0).line());
        assertEquals(2L << 30, jobs.get(0).cost());
        assertEquals(List.of("./simulate", "--grid", "fine"), jobs.get(0).argv());
        assertEquals(List.of("echo", "done"), jobs.get(1).argv());
    }

    @Test
    void reports_the_bad_line() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JobFile.parse(List.of("1G ok", "lots run")));
        assertTrue(e.getMessage().startsWith("line 2"));
        assertThrows(IllegalArgumentException.class, () -> JobFile.parse(List.of("100")));
    }
}
