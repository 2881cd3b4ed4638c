package com.autofix.vcs;

import com.autofix.core.error.StageError;
import com.autofix.core.error.WorkspaceErrorCode;
import com.autofix.core.model.ChangeType;
import com.autofix.core.model.FileChange;
import com.autofix.core.model.Workspace;
import com.autofix.core.model.WorkspaceStatus;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessExecutionException;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Manages git worktrees for issue groups.
 *
 * <p>Each group gets its own worktree on a fresh branch cut from the base branch,
 * created as a directory under the configured base directory.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessRunner}
 * rather than depending on JGit.
 */
public class GitWorktreeManager implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeManager.class);

    static final Set<String> PROTECTED_BRANCHES = Set.of("main", "master", "develop");

    /**
     * Characters and sequences git refuses in ref names.
     */
    private static final Pattern INVALID_REF = Pattern.compile(
            "(^[-/.])|(\\.\\.)|([\\s~^:?*\\[\\\\])|(@\\{)|(//)|(\\.lock$)|([/.]$)|(\\p{Cntrl})"
    );

    private final Path repoPath;
    private final Path baseDir;
    private final String prefix;
    private final ProcessRunner processRunner;
    private final Duration gitTimeout;

    public GitWorktreeManager(Path repoPath, Path baseDir, String prefix, ProcessRunner processRunner) {
        this(repoPath, baseDir, prefix, processRunner, Duration.ofMinutes(2));
    }

    public GitWorktreeManager(Path repoPath, Path baseDir, String prefix,
                              ProcessRunner processRunner, Duration gitTimeout) {
        this.repoPath = repoPath.toAbsolutePath().normalize();
        this.baseDir = baseDir.isAbsolute() ? baseDir : this.repoPath.resolve(baseDir);
        this.prefix = prefix == null ? "" : prefix;
        this.processRunner = processRunner;
        this.gitTimeout = gitTimeout;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // GIT WORKTREE OPERATIONS
    // ══════════════════════════════════════════════════════════════════════════

    @Override
    public Result<Workspace, StageError> createWorkspace(String branch, String baseBranch, List<Integer> issueNumbers) {
        if (!isValidBranchName(branch)) {
            return error(WorkspaceErrorCode.INVALID_BRANCH, "Invalid branch name: '" + branch + "'");
        }

        try {
            if (git(repoPath, "fetch", "origin").exitCode() != 0) {
                log.warn("git fetch origin failed in {}, continuing with local refs", repoPath);
            }

            if (refExists("refs/heads/" + branch) || refExists("refs/remotes/origin/" + branch)) {
                return error(WorkspaceErrorCode.BRANCH_EXISTS, "Branch already exists: " + branch);
            }

            String baseRef;
            if (refExists("refs/remotes/origin/" + baseBranch)) {
                baseRef = "origin/" + baseBranch;
            } else if (refExists("refs/heads/" + baseBranch)) {
                baseRef = baseBranch;
            } else {
                return error(WorkspaceErrorCode.BRANCH_NOT_FOUND, "Base branch not found: " + baseBranch);
            }

            Path worktreePath = worktreePathFor(branch);
            if (Files.exists(worktreePath)) {
                return error(WorkspaceErrorCode.GIT_ERROR, "Worktree already exists at " + worktreePath);
            }
            Files.createDirectories(baseDir);

            log.info("Adding worktree at {} (branch: {}, base: {})", worktreePath, branch, baseRef);
            CommandResult add = git(repoPath, "worktree", "add", "-b", branch, worktreePath.toString(), baseRef);
            if (add.exitCode() != 0) {
                String detail = firstNonBlank(add.stderr(), add.stdout());
                log.error("Failed to create worktree for {}: {}", branch, detail);
                return error(WorkspaceErrorCode.GIT_ERROR, "git worktree add failed: " + detail);
            }

            Instant now = Instant.now();
            return Result.ok(new Workspace(worktreePath, branch, baseBranch, WorkspaceStatus.READY,
                    issueNumbers, now, now));
        } catch (IOException | ProcessExecutionException e) {
            log.error("Worktree creation failed for {}: {}", branch, e.getMessage());
            return Result.err(StageError.of(WorkspaceErrorCode.UNKNOWN, e.getMessage(), e));
        }
    }

    /**
     * Removes a worktree. Falls back to deleting the directory and pruning when
     * {@code git worktree remove} fails.
     */
    @Override
    public Result<Void, StageError> removeWorkspace(Path path, RemoveOptions options) {
        try {
            if (path == null || !Files.isDirectory(path)) {
                git(repoPath, "worktree", "prune");
                return error(WorkspaceErrorCode.WORKTREE_NOT_FOUND, "Worktree not found at " + path);
            }

            String branch = currentBranch(path);
            log.info("Removing worktree at {} (branch: {})", path, branch);

            List<String> args = new ArrayList<>(List.of("worktree", "remove"));
            if (options.force()) {
                args.add("--force");
            }
            args.add(path.toString());
            if (git(repoPath, args.toArray(String[]::new)).exitCode() != 0) {
                log.warn("git worktree remove failed for {}, attempting manual cleanup", path);
                deleteDirectory(path);
                git(repoPath, "worktree", "prune");
            }

            if (options.deleteBranch() && branch != null && !PROTECTED_BRANCHES.contains(branch)) {
                if (git(repoPath, "branch", "-D", branch).exitCode() != 0) {
                    log.warn("Could not delete branch {}", branch);
                }
            }
            return Result.ok(null);
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(WorkspaceErrorCode.GIT_ERROR, e.getMessage(), e));
        }
    }

    @Override
    public Result<CommandResult, StageError> execInWorkspace(Path path, List<String> gitArgs) {
        if (path == null || !Files.isDirectory(path)) {
            return error(WorkspaceErrorCode.WORKTREE_NOT_FOUND, "Worktree not found at " + path);
        }
        try {
            CommandResult result = git(path, gitArgs.toArray(String[]::new));
            if (result.exitCode() != 0) {
                return error(WorkspaceErrorCode.GIT_ERROR, "git " + String.join(" ", gitArgs)
                        + " failed: " + firstNonBlank(result.stderr(), result.stdout()));
            }
            return Result.ok(result);
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(WorkspaceErrorCode.GIT_ERROR, e.getMessage(), e));
        }
    }

    @Override
    public boolean hasUncommittedChanges(Path path) {
        if (path == null || !Files.isDirectory(path)) {
            return false;
        }
        CommandResult status = git(path, "status", "--porcelain");
        return status.exitCode() == 0 && !status.stdout().isBlank();
    }

    @Override
    public List<FileChange> listChanges(Path path) {
        CommandResult status = git(path, "status", "--porcelain", "--untracked-files=all");
        if (status.exitCode() != 0) {
            log.warn("git status failed in {}: {}", path, status.stderr());
            return List.of();
        }
        return parseStatus(status.stdout(), path);
    }

    /**
     * Lists worktree directories registered with the repository, excluding the main checkout.
     */
    public List<Path> listWorktrees() {
        CommandResult result = git(repoPath, "worktree", "list", "--porcelain");
        List<Path> worktrees = new ArrayList<>();
        for (String line : result.stdout().split("\n")) {
            if (line.startsWith("worktree ")) {
                Path worktreePath = Path.of(line.substring("worktree ".length()).trim());
                if (!worktreePath.normalize().equals(repoPath)) {
                    worktrees.add(worktreePath);
                }
            }
        }
        return worktrees;
    }

    Path worktreePathFor(String branch) {
        String sanitized = branch.replaceAll("[^a-zA-Z0-9-]", "-").replaceAll("-+", "-");
        return baseDir.resolve(prefix + sanitized);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // UTILITY METHODS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Parses {@code git status --porcelain} output into file changes, reading current
     * contents of files that still exist.
     */
    List<FileChange> parseStatus(String porcelain, Path worktree) {
        if (porcelain == null || porcelain.isBlank()) {
            return List.of();
        }
        var changes = new ArrayList<FileChange>();
        for (String line : porcelain.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            String code = line.substring(0, 2);
            String file = line.substring(3).trim();
            int arrow = file.indexOf(" -> ");
            if (arrow >= 0) {
                file = file.substring(arrow + 4);
            }
            file = unquote(file);

            ChangeType type;
            if (code.contains("D")) {
                type = ChangeType.DELETED;
            } else if (code.equals("??") || code.contains("A")) {
                type = ChangeType.ADDED;
            } else {
                type = ChangeType.MODIFIED;
            }
            String content = type == ChangeType.DELETED ? "" : readContent(worktree.resolve(file));
            changes.add(new FileChange(file, content, type));
        }
        return changes;
    }

    static boolean isValidBranchName(String branch) {
        return branch != null && !branch.isBlank() && !INVALID_REF.matcher(branch).find();
    }

    private boolean refExists(String ref) {
        return git(repoPath, "rev-parse", "--verify", "--quiet", ref).exitCode() == 0;
    }

    private String currentBranch(Path worktree) {
        CommandResult result = git(worktree, "rev-parse", "--abbrev-ref", "HEAD");
        String name = result.stdout().trim();
        return result.exitCode() == 0 && !name.isEmpty() && !"HEAD".equals(name) ? name : null;
    }

    /**
     * Runs a git command and captures its output.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "worktree", "add", ...)
     */
    CommandResult git(Path workDir, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        CommandResult result = processRunner.run(workDir, command, gitTimeout);
        if (!result.stdout().isBlank()) {
            log.debug("git: {}", ProcessRunner.maskSensitiveData(result.stdout().strip()));
        }
        return result;
    }

    private static String readContent(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            // binary or unreadable; nothing to scan
            log.debug("Skipping content of {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static String unquote(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    private static String firstNonBlank(String a, String b) {
        return (a != null && !a.isBlank() ? a : b == null ? "" : b).strip();
    }

    private static <T> Result<T, StageError> error(WorkspaceErrorCode code, String message) {
        return Result.err(StageError.of(code, message));
    }

    private static void deleteDirectory(Path dir) {
        try (var walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Manual cleanup of {} failed: {}", dir, e.getMessage());
        }
    }
}
