package io.leavesfly.meer.cli;

import io.leavesfly.meer.orchestrator.DelegationOptions;
import io.leavesfly.meer.orchestrator.ParallelTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParallelCommand 单元测试
 */
class ParallelCommandTest {

    @Test
    void testParseTasks() {
        DelegationOptions options = DelegationOptions.withTimeout(30_000L);

        List<ParallelTask> tasks = ParallelCommand.parseTasks(
                List.of("code-reviewer=Review src/Main.java", " test-writer = Add tests for a=b parsing"), options);

        assertEquals(2, tasks.size());
        assertEquals("code-reviewer", tasks.get(0).getAgentName());
        assertEquals("Review src/Main.java", tasks.get(0).getTask());
        assertEquals("test-writer", tasks.get(1).getAgentName());
        assertEquals("Add tests for a=b parsing", tasks.get(1).getTask());
        assertSame(options, tasks.get(1).getOptions());
    }

    @Test
    void testRejectsMalformedTasks() {
        DelegationOptions options = DelegationOptions.defaults();

        assertThrows(IllegalArgumentException.class, () -> ParallelCommand.parseTasks(List.of("no-separator"), options));
        assertThrows(IllegalArgumentException.class, () -> ParallelCommand.parseTasks(List.of("=task only"), options));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ParallelCommand.parseTasks(List.of("agent="), options));
        assertEquals("Invalid task 'agent=', expected agent=description", e.getMessage());
    }
}
