package com.codemend.core.executor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTest {

    @Test
    void testQuotedArgumentsStayTogether() {
        CommandLine command = CommandLine.parse("  git commit -m \"fix the build\" --author='A B'  ");

        assertEquals("git", command.getExecutable());
        assertEquals(List.of("commit", "-m", "fix the build", "--author=", "A B"), command.getArguments());
        assertEquals("git commit -m \"fix the build\" --author='A B'", command.getOriginal());
    }

    @Test
    void testDisplayQuotesArgumentsWithSpaces() {
        CommandLine command = CommandLine.parse("echo 'hello world' plain");

        assertEquals("echo 'hello world' plain", command.toDisplayString());
        assertEquals(List.of("echo", "hello world", "plain"), command.toArgv());
    }

    @Test
    void testEmptyCommand() {
        CommandLine command = CommandLine.parse(null);

        assertEquals("", command.getExecutable());
        assertTrue(command.getArguments().isEmpty());
    }
}
