package com.crewloop.core.workspace;

import com.crewloop.core.model.MergeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitWorktreeManager}.
 *
 * <p>Uses a test subclass to intercept git commands, so command construction and output
 * parsing can be checked without a real repository.
 */
class GitWorktreeManagerTest {

    @TempDir
    Path tempDir;

    private Path workspace;
    private TestableGitWorktreeManager manager;

    @BeforeEach
    void setUp() throws Exception {
        workspace = Files.createDirectories(tempDir.resolve("project"));
        manager = new TestableGitWorktreeManager(workspace, "main");
    }

    @Test
    @DisplayName("worktrees live next to the workspace, one directory per worker and task")
    void layout() {
        assertEquals(tempDir.resolve("project-worktrees").toAbsolutePath().normalize(), manager.getWorktreesBasePath());
        assertEquals(manager.getWorktreesBasePath().resolve("homer").resolve("T-1"), manager.getWorktreePath("homer", "T-1"));
        assertEquals("crewloop/homer/T-1", manager.getBranchName("homer", "T-1"));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("adds a worktree on a new branch")
        void addsWorktree() {
            var info = manager.create("homer", "T-1");

            Path expected = manager.getWorktreePath("homer", "T-1");
            assertEquals(expected, info.path());
            assertEquals("crewloop/homer/T-1", info.branch());
            assertEquals("homer", info.workerName());
            assertEquals("T-1", info.taskId());
            assertEquals(List.of(List.of("worktree", "add", expected.toString(), "-b", "crewloop/homer/T-1")),
                    manager.getExecutedCommands());
            assertTrue(Files.isDirectory(expected.getParent()));
        }

        @Test
        @DisplayName("replaces a worktree left over from an earlier run")
        void replacesLeftover() throws Exception {
            Files.createDirectories(manager.getWorktreePath("homer", "T-1"));

            manager.create("homer", "T-1");

            var commands = manager.getExecutedCommands();
            assertEquals("remove", commands.get(0).get(1));
            assertEquals(List.of("branch", "-D", "crewloop/homer/T-1"), commands.get(1));
            assertEquals("add", commands.get(2).get(1));
        }

        @Test
        @DisplayName("throws when git refuses")
        void failure() {
            manager.respond("worktree add", 128, "fatal: a branch named 'crewloop/homer/T-1' already exists");

            var error = assertThrows(WorkspaceException.class, () -> manager.create("homer", "T-1"));
            assertTrue(error.getMessage().contains("already exists"));
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("checks out trunk and merges without fast-forward")
        void merges() {
            MergeResult result = manager.merge("homer", "T-1");

            assertTrue(result.success());
            assertFalse(result.hadConflicts());
            assertEquals(List.of(
                    List.of("checkout", "main"),
                    List.of("merge", "crewloop/homer/T-1", "--no-ff", "-m", "Merge crewloop/homer/T-1")),
                    manager.getExecutedCommands());
        }

        @Test
        @DisplayName("reports conflicts")
        void conflicts() {
            manager.respond("merge crewloop/homer/T-1", 1,
                    "CONFLICT (content): Merge conflict in src/App.java\nAutomatic merge failed; fix conflicts");

            MergeResult result = manager.merge("homer", "T-1");
            manager.abortMerge();

            assertFalse(result.success());
            assertTrue(result.hadConflicts());
            assertEquals(List.of("merge", "--abort"),
                    manager.getExecutedCommands().get(manager.getExecutedCommands().size() - 1));
        }

        @Test
        @DisplayName("other failures are not conflicts")
        void fails() {
            manager.respond("checkout", 1, "error: pathspec 'main' did not match");

            MergeResult result = manager.merge("homer", "T-1");

            assertFalse(result.success());
            assertFalse(result.hadConflicts());
            assertTrue(result.message().contains("pathspec"));
        }

        @Test
        @DisplayName("a conflicted merge holds the trunk until it is aborted")
        void conflictHoldsTrunk() throws Exception {
            manager.respond("merge crewloop/homer/T-1", 1, "CONFLICT (content): Merge conflict in a.txt");
            manager.respond("remote", 0, "");
            manager.merge("homer", "T-1");

            var other = new Thread(manager::pullLatest);
            other.start();
            other.join(200);
            assertTrue(other.isAlive(), "trunk operation should wait for the conflicted merge");

            manager.abortMerge();
            other.join(5000);
            assertFalse(other.isAlive());
        }

        @Test
        @DisplayName("lists unmerged files")
        void conflictingFiles() {
            manager.respond("diff", 0, "src/App.java\nREADME.md\n");

            assertEquals(List.of("src/App.java", "README.md"), manager.getConflictingFiles());
        }

        @Test
        @DisplayName("no unmerged files yields an empty list")
        void noConflictingFiles() {
            assertTrue(manager.getConflictingFiles().isEmpty());
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        @DisplayName("removes the worktree and deletes its branch")
        void removes() {
            manager.remove("homer", "T-1");

            var commands = manager.getExecutedCommands();
            assertEquals(List.of("worktree", "remove", manager.getWorktreePath("homer", "T-1").toString(), "--force"),
                    commands.get(0));
            assertEquals(List.of("branch", "-D", "crewloop/homer/T-1"), commands.get(1));
        }

        @Test
        @DisplayName("tolerates an already removed worktree and branch")
        void idempotent() {
            manager.respond("worktree remove", 128, "fatal: '/x' is not a working tree");
            manager.respond("branch", 1, "error: branch 'crewloop/homer/T-1' not found.");

            assertDoesNotThrow(() -> manager.remove("homer", "T-1"));
        }

        @Test
        @DisplayName("other failures are raised")
        void failure() {
            manager.respond("worktree remove", 128, "fatal: permission denied");

            assertThrows(WorkspaceException.class, () -> manager.remove("homer", "T-1"));
        }
    }

    @Nested
    @DisplayName("trunk")
    class Trunk {

        @Test
        @DisplayName("detects master when main does not exist")
        void detectsMaster() {
            var detecting = new TestableGitWorktreeManager(workspace, null);
            detecting.respond("show-ref --verify --quiet refs/heads/main", 1, "");

            assertEquals("master", detecting.getMainBranch());
        }

        @Test
        @DisplayName("pull is skipped without a remote")
        void pullWithoutRemote() {
            manager.pullLatest();

            assertEquals(List.of(List.of("remote")), manager.getExecutedCommands());
        }

        @Test
        @DisplayName("pull fast-forwards when a remote exists")
        void pullWithRemote() {
            manager.respond("remote", 0, "origin");

            manager.pullLatest();

            assertEquals(List.of("pull", "--ff-only"), manager.getExecutedCommands().get(1));
        }
    }

    @Test
    @DisplayName("list returns only managed worktrees")
    void list() {
        Path homerTree = manager.getWorktreePath("homer", "T-1");
        Path margeTree = manager.getWorktreePath("marge", "T-2");
        manager.respond("worktree list", 0, String.join("\n",
                "worktree " + workspace,
                "HEAD abc",
                "branch refs/heads/main",
                "",
                "worktree " + homerTree,
                "HEAD def",
                "branch refs/heads/crewloop/homer/T-1",
                "",
                "worktree " + margeTree,
                "HEAD 123",
                "branch refs/heads/crewloop/marge/T-2"));

        var all = manager.list(null);
        var homer = manager.list("homer");

        assertEquals(2, all.size());
        assertEquals(1, homer.size());
        assertEquals("T-1", homer.get(0).taskId());
        assertEquals(homerTree, homer.get(0).path());
    }

    /**
     * Test subclass that records git invocations and answers them from a script
     * keyed by command prefix.
     */
    static class TestableGitWorktreeManager extends GitWorktreeManager {

        private final List<List<String>> executedCommands = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, GitResult> responses = new HashMap<>();

        TestableGitWorktreeManager(Path workspace, String mainBranch) {
            super(workspace, mainBranch, null);
        }

        void respond(String commandPrefix, int exitCode, String output) {
            responses.put(commandPrefix, new GitResult(exitCode, output));
        }

        List<List<String>> getExecutedCommands() {
            return new ArrayList<>(executedCommands);
        }

        @Override
        GitResult runGit(Path workDir, String... args) {
            executedCommands.add(List.of(args));
            String command = String.join(" ", Arrays.asList(args));
            String bestMatch = null;
            for (String prefix : responses.keySet()) {
                if (command.startsWith(prefix) && (bestMatch == null || prefix.length() > bestMatch.length())) {
                    bestMatch = prefix;
                }
            }
            return bestMatch != null ? responses.get(bestMatch) : new GitResult(0, "");
        }
    }
}
