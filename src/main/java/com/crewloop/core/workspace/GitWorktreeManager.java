package com.crewloop.core.workspace;

import com.crewloop.core.metrics.CrewloopMetrics;
import com.crewloop.core.model.MergeResult;
import com.crewloop.core.model.WorktreeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * {@link WorkspaceManager} backed by {@code git worktree}.
 *
 * <p>Each worker gets its own worktrees in a sibling folder of the main workspace:
 * <pre>
 * project/                     main workspace (trunk checked out)
 * project-worktrees/
 *   homer/
 *     bd-abc123/               branch crewloop/homer/bd-abc123
 *   marge/
 *     bd-def456/               branch crewloop/marge/bd-def456
 * </pre>
 *
 * <p>All trunk operations run in the main workspace and are serialized by a trunk lock.
 * A merge that stops on conflicts keeps the lock until {@link #abortMerge()} or
 * {@link #completeMerge(String, String)} is called by the same thread.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder}.
 */
public class GitWorktreeManager implements WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeManager.class);

    static final String BRANCH_PREFIX = "crewloop/";

    private final Path mainWorkspacePath;
    private final Path worktreesBasePath;
    private final String configuredMainBranch;
    private final CrewloopMetrics metrics;
    private final ReentrantLock trunkLock = new ReentrantLock();

    public GitWorktreeManager(Path mainWorkspacePath) {
        this(mainWorkspacePath, null, null);
    }

    /**
     * @param mainWorkspacePath    the main repository checkout
     * @param configuredMainBranch trunk branch, or null/blank to detect {@code main} then {@code master}
     * @param metrics              optional metrics sink
     */
    public GitWorktreeManager(Path mainWorkspacePath, String configuredMainBranch, CrewloopMetrics metrics) {
        this.mainWorkspacePath = mainWorkspacePath.toAbsolutePath().normalize();
        Path fileName = this.mainWorkspacePath.getFileName();
        String projectName = fileName != null ? fileName.toString() : "workspace";
        Path parent = this.mainWorkspacePath.getParent() != null ? this.mainWorkspacePath.getParent() : this.mainWorkspacePath;
        this.worktreesBasePath = parent.resolve(projectName + "-worktrees");
        this.configuredMainBranch = configuredMainBranch;
        this.metrics = metrics;
    }

    public Path getMainWorkspacePath() {
        return mainWorkspacePath;
    }

    public Path getWorktreesBasePath() {
        return worktreesBasePath;
    }

    public Path getWorktreePath(String workerName, String taskId) {
        return worktreesBasePath.resolve(workerName).resolve(taskId);
    }

    public String getBranchName(String workerName, String taskId) {
        return BRANCH_PREFIX + workerName + "/" + taskId;
    }

    @Override
    public void pullLatest() {
        trunkLock.lock();
        try {
            GitResult remotes = runGit(mainWorkspacePath, "remote");
            if (!remotes.succeeded() || remotes.output().isBlank()) {
                return;
            }
            GitResult pull = runGit(mainWorkspacePath, "pull", "--ff-only");
            if (!pull.succeeded()) {
                log.debug("Pull skipped: {}", pull.output());
            }
        } catch (WorkspaceException e) {
            log.debug("Pull skipped: {}", e.getMessage());
        } finally {
            trunkLock.unlock();
        }
    }

    @Override
    public WorktreeInfo create(String workerName, String taskId) {
        Path worktreePath = getWorktreePath(workerName, taskId);
        String branchName = getBranchName(workerName, taskId);

        if (exists(workerName, taskId)) {
            log.warn("Worktree {} left over from an earlier run, recreating", worktreePath);
            remove(workerName, taskId);
        }

        try {
            Files.createDirectories(worktreePath.getParent());
        } catch (IOException e) {
            recordOperation("create", false);
            throw new WorkspaceException("Failed to create worktree directory " + worktreePath.getParent(), e);
        }

        trunkLock.lock();
        try {
            git(mainWorkspacePath, "worktree", "add", worktreePath.toString(), "-b", branchName);
        } catch (WorkspaceException e) {
            recordOperation("create", false);
            throw e;
        } finally {
            trunkLock.unlock();
        }

        recordOperation("create", true);
        log.info("Created worktree {} on branch {}", worktreePath, branchName);
        return new WorktreeInfo(worktreePath, branchName, workerName, taskId);
    }

    @Override
    public MergeResult merge(String workerName, String taskId) {
        String branchName = getBranchName(workerName, taskId);
        trunkLock.lock();
        boolean keepLock = false;
        try {
            String mainBranch = getMainBranch();
            GitResult checkout = runGit(mainWorkspacePath, "checkout", mainBranch);
            if (!checkout.succeeded()) {
                recordOperation("merge", false);
                return MergeResult.failed("Merge failed: " + checkout.describe("checkout"));
            }

            GitResult merge = runGit(mainWorkspacePath, "merge", branchName, "--no-ff", "-m", "Merge " + branchName);
            if (merge.succeeded()) {
                recordOperation("merge", true);
                log.info("Merged {} into {}", branchName, mainBranch);
                return MergeResult.merged("Successfully merged " + branchName + " to " + mainBranch);
            }

            recordOperation("merge", false);
            String output = merge.output();
            if (output.contains("CONFLICT") || output.contains("Automatic merge failed")) {
                keepLock = true;
                log.warn("Merge conflicts detected in {}", branchName);
                return MergeResult.conflicted("Merge conflicts detected in " + branchName);
            }
            return MergeResult.failed("Merge failed: " + merge.describe("merge"));
        } catch (WorkspaceException e) {
            recordOperation("merge", false);
            return MergeResult.failed("Merge failed: " + e.getMessage());
        } finally {
            if (!keepLock) {
                trunkLock.unlock();
            }
        }
    }

    @Override
    public List<String> getConflictingFiles() {
        GitResult result = runGit(mainWorkspacePath, "diff", "--name-only", "--diff-filter=U");
        if (!result.succeeded() || result.output().isBlank()) {
            return List.of();
        }
        return Arrays.stream(result.output().split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * @return true while {@code MERGE_HEAD} exists in the main workspace
     */
    public boolean isMergeInProgress() {
        return runGit(mainWorkspacePath, "rev-parse", "--verify", "MERGE_HEAD").succeeded();
    }

    @Override
    public void abortMerge() {
        try {
            git(mainWorkspacePath, "merge", "--abort");
        } finally {
            releaseMergeHold();
        }
    }

    /**
     * Commits a merge whose conflicts were resolved and staged in the main workspace.
     */
    public MergeResult completeMerge(String workerName, String taskId) {
        String branchName = getBranchName(workerName, taskId);
        try {
            List<String> conflicts = getConflictingFiles();
            if (!conflicts.isEmpty()) {
                return MergeResult.conflicted(
                        "Cannot complete merge: %d file(s) still have conflicts".formatted(conflicts.size()));
            }
            GitResult commit = runGit(mainWorkspacePath, "commit", "--no-edit");
            if (!commit.succeeded()) {
                return MergeResult.failed("Failed to complete merge: " + commit.describe("commit"));
            }
            releaseMergeHold();
            return MergeResult.merged("Successfully completed merge of " + branchName);
        } catch (WorkspaceException e) {
            return MergeResult.failed("Failed to complete merge: " + e.getMessage());
        }
    }

    @Override
    public void remove(String workerName, String taskId) {
        Path worktreePath = getWorktreePath(workerName, taskId);
        String branchName = getBranchName(workerName, taskId);

        trunkLock.lock();
        try {
            GitResult removeTree = runGit(mainWorkspacePath, "worktree", "remove", worktreePath.toString(), "--force");
            if (!removeTree.succeeded() && !removeTree.output().contains("is not a working tree")) {
                recordOperation("remove", false);
                throw new WorkspaceException("Failed to remove worktree: " + removeTree.describe("worktree remove"));
            }

            GitResult deleteBranch = runGit(mainWorkspacePath, "branch", "-D", branchName);
            if (!deleteBranch.succeeded() && !deleteBranch.output().contains("not found")) {
                recordOperation("remove", false);
                throw new WorkspaceException("Failed to delete branch: " + deleteBranch.describe("branch -D"));
            }
        } finally {
            trunkLock.unlock();
        }

        recordOperation("remove", true);
        log.info("Removed worktree {} and branch {}", worktreePath, branchName);
    }

    /**
     * Lists the worktrees this manager created, optionally only those of one worker.
     *
     * @param workerName worker filter, or null for all workers
     */
    public List<WorktreeInfo> list(String workerName) {
        String output = git(mainWorkspacePath, "worktree", "list", "--porcelain");
        var worktrees = new ArrayList<WorktreeInfo>();
        String currentPath = null;
        String currentBranch = null;

        for (String line : output.split("\n")) {
            if (line.startsWith("worktree ")) {
                addIfManaged(currentPath, currentBranch, workerName, worktrees);
                currentPath = line.substring("worktree ".length());
                currentBranch = null;
            } else if (line.startsWith("branch refs/heads/")) {
                currentBranch = line.substring("branch refs/heads/".length());
            }
        }
        addIfManaged(currentPath, currentBranch, workerName, worktrees);
        return worktrees;
    }

    public boolean exists(String workerName, String taskId) {
        return Files.isDirectory(getWorktreePath(workerName, taskId));
    }

    /**
     * Drops worktree metadata for directories that no longer exist.
     */
    public void prune() {
        git(mainWorkspacePath, "worktree", "prune");
    }

    private void addIfManaged(String path, String branch, String workerFilter, List<WorktreeInfo> out) {
        if (path == null || branch == null || !branch.startsWith(BRANCH_PREFIX)) {
            return;
        }
        if (!Path.of(path).toAbsolutePath().normalize().startsWith(worktreesBasePath)) {
            return;
        }
        String rest = branch.substring(BRANCH_PREFIX.length());
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            return;
        }
        String worker = rest.substring(0, slash);
        String taskId = rest.substring(slash + 1);
        if (workerFilter != null && !workerFilter.equals(worker)) {
            return;
        }
        out.add(new WorktreeInfo(Path.of(path), branch, worker, taskId));
    }

    String getMainBranch() {
        if (configuredMainBranch != null && !configuredMainBranch.isBlank()) {
            return configuredMainBranch;
        }
        if (runGit(mainWorkspacePath, "show-ref", "--verify", "--quiet", "refs/heads/main").succeeded()) {
            return "main";
        }
        if (runGit(mainWorkspacePath, "show-ref", "--verify", "--quiet", "refs/heads/master").succeeded()) {
            return "master";
        }
        return "main";
    }

    private void releaseMergeHold() {
        if (trunkLock.isHeldByCurrentThread()) {
            trunkLock.unlock();
        }
    }

    private void recordOperation(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorktreeOperation(operation, success);
        }
    }

    /**
     * Runs a git command and returns its output, failing on a non-zero exit.
     */
    String git(Path workDir, String... args) {
        GitResult result = runGit(workDir, args);
        if (!result.succeeded()) {
            throw new WorkspaceException(result.describe(args[0]));
        }
        return result.output();
    }

    /**
     * Runs a git command and captures combined stdout and stderr.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "worktree", "add", path)
     * @return exit code and trimmed output
     */
    GitResult runGit(Path workDir, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            return new GitResult(process.waitFor(), output.trim());
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw new WorkspaceException("Git command failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("Interrupted while running git " + args[0], e);
        }
    }

    /**
     * Exit code and combined output of one git invocation.
     */
    record GitResult(int exitCode, String output) {

        boolean succeeded() {
            return exitCode == 0;
        }

        String describe(String subcommand) {
            return output.isEmpty()
                    ? "git %s failed with code %d".formatted(subcommand, exitCode)
                    : output;
        }
    }
}
