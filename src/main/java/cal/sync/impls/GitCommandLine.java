package cal.sync.impls;

import cal.sync.Util;
import cal.sync.types.VersionControl;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link VersionControl} by running the <code>git</code> executable in the
 * working copy.  Output is captured; a non-zero exit status becomes a
 * {@link CommandFailed}.  Anything that may contain the remote URL is passed
 * through {@link Util#maskCredentials(String)} before it is logged or thrown.
 */
public class GitCommandLine implements VersionControl {

  private static final Logger logger = LoggerFactory.getLogger(GitCommandLine.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);
  static final String REMOTE = "origin";
  static final String DEFAULT_USER_NAME = "lfs-sync";
  static final String DEFAULT_USER_EMAIL = "lfs-sync@localhost";

  public static class CommandFailed extends IOException {
    private final int exitCode;
    private final String stderr;

    public CommandFailed(String command, int exitCode, String stderr) {
      super(command + " exited with status " + exitCode + (stderr.isBlank() ? "" : ": " + stderr.strip()));
      this.exitCode = exitCode;
      this.stderr = stderr;
    }

    public int exitCode() {
      return exitCode;
    }

    public String stderr() {
      return stderr;
    }
  }

  private record Result(int exitCode, String stdout, String stderr) {
  }

  private final String executable;
  private final Path repoDir;
  private final String branch;
  private final Duration timeout;

  public GitCommandLine(Path repoDir, String branch) {
    this("git", repoDir, branch, DEFAULT_TIMEOUT);
  }

  public GitCommandLine(String executable, Path repoDir, String branch, Duration timeout) {
    this.executable = executable;
    this.repoDir = repoDir;
    this.branch = branch;
    this.timeout = timeout;
  }

  @Override
  public void ensureRepository() throws IOException {
    Files.createDirectories(repoDir);
    if (!Files.isDirectory(repoDir.resolve(".git"))) {
      logger.info("Initializing repository in {}", repoDir);
      git("init");
      git("checkout", "-B", branch);
    }
    if (run(ImmutableList.of("config", "user.name")).exitCode != 0) {
      git("config", "user.name", DEFAULT_USER_NAME);
    }
    if (run(ImmutableList.of("config", "user.email")).exitCode != 0) {
      git("config", "user.email", DEFAULT_USER_EMAIL);
    }
  }

  @Override
  public void setRemote(String url) throws IOException {
    Result existing = run(ImmutableList.of("remote", "get-url", REMOTE));
    if (existing.exitCode == 0) {
      if (!existing.stdout.strip().equals(url)) {
        git("remote", "set-url", REMOTE, url);
      }
    } else {
      git("remote", "add", REMOTE, url);
    }
  }

  @Override
  public boolean remoteIsEmpty() throws IOException {
    return git("ls-remote", "--heads", REMOTE).isBlank();
  }

  @Override
  public void createInitialCommitIfNeeded() throws IOException {
    if (headCommit() == null) {
      git("commit", "--allow-empty", "-m", "Initial commit");
    }
  }

  @Override
  public void fetchAndReset() throws IOException {
    git("fetch", REMOTE, branch);
    git("checkout", "-B", branch, REMOTE + '/' + branch);
    git("reset", "--hard", REMOTE + '/' + branch);
  }

  @Override
  public void pullRebase() throws IOException {
    git("pull", "--rebase", REMOTE, branch);
  }

  @Override
  public boolean commitAllIfDirty(String message) throws IOException {
    git("add", "-A");
    if (git("status", "--porcelain").isBlank()) {
      return false;
    }
    git("commit", "-m", message);
    return true;
  }

  @Override
  public void push() throws IOException {
    git("push", "-u", REMOTE, branch);
  }

  @Override
  public @Nullable String headCommit() throws IOException {
    return revParse("HEAD");
  }

  @Override
  public @Nullable String remoteHeadCommit() throws IOException {
    return revParse(REMOTE + '/' + branch);
  }

  private @Nullable String revParse(String ref) throws IOException {
    Result r = run(ImmutableList.of("rev-parse", "--verify", "--quiet", ref));
    if (r.exitCode != 0) {
      return null;
    }
    String id = r.stdout.strip();
    return id.isEmpty() ? null : id;
  }

  @Override
  public boolean isTracked(String repoRelativePath) throws IOException {
    return run(ImmutableList.of("ls-files", "--error-unmatch", "--", repoRelativePath)).exitCode == 0;
  }

  @Override
  public void unstage(String repoRelativePath) throws IOException {
    git("rm", "--cached", "--quiet", "--", repoRelativePath);
  }

  private String git(String... args) throws IOException {
    List<String> argList = ImmutableList.copyOf(args);
    Result r = run(argList);
    if (r.exitCode != 0) {
      throw new CommandFailed(describe(argList), r.exitCode, Util.maskCredentials(r.stderr));
    }
    return r.stdout;
  }

  private static String describe(List<String> args) {
    return Util.maskCredentials("git " + String.join(" ", args));
  }

  private Result run(List<String> args) throws IOException {
    List<String> command = new ArrayList<>();
    command.add(executable);
    command.addAll(args);
    logger.debug("Running {}", describe(args));

    Path out = Files.createTempFile("git-out", ".txt");
    Path err = Files.createTempFile("git-err", ".txt");
    try {
      ProcessBuilder pb = new ProcessBuilder(command)
              .directory(repoDir.toFile())
              .redirectOutput(out.toFile())
              .redirectError(err.toFile());
      pb.environment().put("GIT_TERMINAL_PROMPT", "0");
      Process process = pb.start();
      try {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          process.destroyForcibly();
          throw new IOException(describe(args) + " timed out after " + timeout);
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        InterruptedIOException wrapped = new InterruptedIOException("interrupted while running " + describe(args));
        wrapped.initCause(e);
        throw wrapped;
      }
      return new Result(
              process.exitValue(),
              Files.readString(out, StandardCharsets.UTF_8),
              Files.readString(err, StandardCharsets.UTF_8));
    } finally {
      Files.deleteIfExists(out);
      Files.deleteIfExists(err);
    }
  }

}
