package cal.sync;

import cal.sync.types.Config;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assembles a {@link Config}.  Sources, lowest precedence first:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>a JSON config file (comments allowed)</li>
 *   <li>environment variables</li>
 *   <li><code>sync-config.json</code> in the repository directory, which may
 *     replace the exclude list</li>
 * </ol>
 * The system excludes are always appended.
 */
public class ConfigLoader {

  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  public static final String DEFAULT_CONFIG_FILE_NAME = ".lfs-sync-config.json";
  public static final String OVERRIDES_FILE_NAME = "sync-config.json";
  public static final ImmutableList<String> SYSTEM_EXCLUDES = ImmutableList.of(
          ".sync-complete",
          ".sync-progress.json",
          ".sync.ready");

  static final String DEFAULT_BRANCH = "main";
  static final long DEFAULT_THRESHOLD = 60 * Util.ONE_MB;
  static final String DEFAULT_CONTAINER_TAG = "large-files-v1";
  static final int DEFAULT_MAX_VERSIONS = 3;
  static final int DEFAULT_WORKERS = 3;
  static final long DEFAULT_INTERVAL_SECONDS = 180;

  public static class ConfigException extends Exception {
    public ConfigException(String message) {
      super(message);
    }

    public ConfigException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  private static class RawConfig {
    public @Nullable String repoDir;
    public @Nullable String branch;
    public @Nullable String remoteRepo;
    public @Nullable String token;
    public @Nullable Boolean offloadEnabled;
    public @Nullable Long threshold;
    public @Nullable String containerTag;
    public @Nullable Integer maxVersions;
    public @Nullable Integer workers;
    public @Nullable Long intervalSeconds;
    public @Nullable Boolean verifyHash;
    public @Nullable List<String> excludes;
    public @Nullable String store;
    public @Nullable String s3Bucket;
    public @Nullable String s3Region;
    public @Nullable String localStoreDir;
  }

  private static class RawOverrides {
    public @Nullable List<String> excludes;
  }

  private final Map<String, String> env;
  private final Path home;
  private final ObjectMapper mapper;

  public ConfigLoader(Map<String, String> env, Path home) {
    this.env = env;
    this.home = home;
    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    this.mapper = new ObjectMapper(f);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public static ConfigLoader fromSystem() {
    return new ConfigLoader(System.getenv(), Paths.get(System.getProperty("user.home")));
  }

  public Path defaultConfigFile() {
    return home.resolve(DEFAULT_CONFIG_FILE_NAME);
  }

  /**
   * @param configFile a config file the user asked for, which must exist; or null
   *   to use {@link #defaultConfigFile()} if it exists
   * @return the validated configuration
   * @throws ConfigException if a source cannot be read or a setting is missing or invalid
   */
  public Config load(@Nullable Path configFile) throws ConfigException {
    RawConfig raw;
    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigException("Config file '" + configFile + "' not found");
      }
      raw = readJson(configFile, RawConfig.class);
    } else if (Files.isRegularFile(defaultConfigFile())) {
      raw = readJson(defaultConfigFile(), RawConfig.class);
    } else {
      raw = new RawConfig();
    }

    Path repoDir = expandHome(firstNonNull(env.get("HIST_DIR"), raw.repoDir, home.resolve(".sync-backup").toString()));
    String branch = firstNonNull(env.get("GIT_BRANCH"), raw.branch, DEFAULT_BRANCH);
    String remoteRepo = firstNonNull(env.get("GITHUB_REPO"), raw.remoteRepo, "");
    String token = firstNonNull(env.get("GITHUB_PAT"), raw.token, "");
    boolean offloadEnabled = bool("LFS_ENABLED", raw.offloadEnabled, true);
    long threshold = number("LFS_THRESHOLD", raw.threshold, DEFAULT_THRESHOLD);
    String containerTag = firstNonNull(env.get("LFS_RELEASE_TAG"), raw.containerTag, DEFAULT_CONTAINER_TAG);
    long maxVersions = number("LFS_MAX_VERSIONS", raw.maxVersions != null ? raw.maxVersions.longValue() : null, DEFAULT_MAX_VERSIONS);
    long workers = number("LFS_MAX_WORKERS", raw.workers != null ? raw.workers.longValue() : null, DEFAULT_WORKERS);
    long intervalSeconds = number("SYNC_INTERVAL", raw.intervalSeconds, DEFAULT_INTERVAL_SECONDS);
    boolean verifyHash = bool("LFS_VERIFY_HASH", raw.verifyHash, true);
    String storeName = firstNonNull(env.get("LFS_STORE"), raw.store, "github");
    @Nullable String s3Bucket = firstNonNullOrNull(env.get("LFS_S3_BUCKET"), raw.s3Bucket);
    @Nullable String s3Region = firstNonNullOrNull(env.get("AWS_REGION"), raw.s3Region);
    @Nullable String localStoreDir = firstNonNullOrNull(env.get("LFS_LOCAL_STORE"), raw.localStoreDir);

    List<String> excludes = new ArrayList<>();
    String envExcludes = env.get("EXCLUDE_PATHS");
    if (envExcludes != null) {
      excludes.addAll(splitWords(envExcludes));
    } else if (raw.excludes != null) {
      excludes.addAll(raw.excludes);
    }
    List<String> overrides = readOverrides(repoDir);
    if (!overrides.isEmpty()) {
      excludes = new ArrayList<>(overrides);
    }
    for (String sys : SYSTEM_EXCLUDES) {
      if (!excludes.contains(sys)) {
        excludes.add(sys);
      }
    }

    if (remoteRepo.isBlank()) {
      throw new ConfigException("No remote repository configured (set GITHUB_REPO or \"remoteRepo\")");
    }
    if (token.isBlank()) {
      throw new ConfigException("No access token configured (set GITHUB_PAT or \"token\")");
    }
    if (threshold <= 0) {
      throw new ConfigException("threshold must be positive, was " + threshold);
    }
    if (maxVersions < 1 || maxVersions > Integer.MAX_VALUE) {
      throw new ConfigException("maxVersions must be at least 1, was " + maxVersions);
    }
    if (workers < 1 || workers > Integer.MAX_VALUE) {
      throw new ConfigException("workers must be at least 1, was " + workers);
    }
    if (intervalSeconds < 1) {
      throw new ConfigException("intervalSeconds must be at least 1, was " + intervalSeconds);
    }
    if (containerTag.isBlank()) {
      throw new ConfigException("containerTag must not be empty");
    }

    Config.StoreKind store;
    try {
      store = Config.StoreKind.valueOf(storeName.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown store '" + storeName + "' (expected github, s3 or local)", e);
    }
    if (offloadEnabled) {
      if (store == Config.StoreKind.S3 && (s3Bucket == null || s3Bucket.isBlank())) {
        throw new ConfigException("store=s3 requires a bucket (set LFS_S3_BUCKET or \"s3Bucket\")");
      }
      if (store == Config.StoreKind.LOCAL && (localStoreDir == null || localStoreDir.isBlank())) {
        throw new ConfigException("store=local requires a directory (set LFS_LOCAL_STORE or \"localStoreDir\")");
      }
    }

    return new Config(
            repoDir,
            branch,
            remoteRepo,
            token,
            offloadEnabled,
            threshold,
            containerTag,
            (int) maxVersions,
            (int) workers,
            Duration.ofSeconds(intervalSeconds),
            verifyHash,
            ImmutableList.copyOf(excludes),
            store,
            s3Bucket,
            s3Region,
            localStoreDir != null ? expandHome(localStoreDir) : null);
  }

  private List<String> readOverrides(Path repoDir) throws ConfigException {
    Path file = repoDir.resolve(OVERRIDES_FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return List.of();
    }
    RawOverrides o;
    try {
      o = readJson(file, RawOverrides.class);
    } catch (ConfigException e) {
      // the file is user-editable at runtime; a typo should not stop the daemon
      logger.warn("Ignoring {}: {}", file, e.getMessage());
      return List.of();
    }
    List<String> result = new ArrayList<>();
    if (o.excludes != null) {
      for (String e : o.excludes) {
        String trimmed = stripSlashes(e == null ? "" : e.strip());
        if (!trimmed.isEmpty()) {
          result.add(trimmed);
        }
      }
    }
    return result;
  }

  private <T> T readJson(Path file, Class<T> type) throws ConfigException {
    try (InputStream in = Files.newInputStream(file)) {
      T value = mapper.readValue(in, type);
      if (value == null) {
        throw new ConfigException("Config file '" + file + "' is empty");
      }
      return value;
    } catch (IOException e) {
      throw new ConfigException("Failed to read config file '" + file + "': " + e.getMessage(), e);
    }
  }

  private boolean bool(String envKey, @Nullable Boolean fromFile, boolean dflt) {
    String v = env.get(envKey);
    if (v != null) {
      return v.trim().equalsIgnoreCase("true");
    }
    return fromFile != null ? fromFile : dflt;
  }

  private long number(String envKey, @Nullable Long fromFile, long dflt) throws ConfigException {
    String v = env.get(envKey);
    if (v != null) {
      try {
        return Long.parseLong(v.trim());
      } catch (NumberFormatException e) {
        throw new ConfigException(envKey + " is not a number: '" + v + '\'', e);
      }
    }
    return fromFile != null ? fromFile : dflt;
  }

  private Path expandHome(String path) {
    if (path.equals("~")) {
      return home;
    }
    if (path.startsWith("~/")) {
      return home.resolve(path.substring(2));
    }
    return Paths.get(path);
  }

  static List<String> splitWords(String s) {
    String trimmed = s.strip();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(trimmed.split("\\s+"));
  }

  static String stripSlashes(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == '/') {
      ++start;
    }
    while (end > start && s.charAt(end - 1) == '/') {
      --end;
    }
    return s.substring(start, end);
  }

  private static String firstNonNull(@Nullable String a, @Nullable String b, String dflt) {
    return a != null ? a : b != null ? b : dflt;
  }

  private static @Nullable String firstNonNullOrNull(@Nullable String a, @Nullable String b) {
    return a != null ? a : b;
  }

}
