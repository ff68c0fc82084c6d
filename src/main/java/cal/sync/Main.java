package cal.sync;

import cal.prim.concurrency.StopSignal;
import cal.prim.storage.BlobStore;
import cal.prim.storage.GitHubReleaseStore;
import cal.prim.storage.LocalBlobStore;
import cal.prim.storage.S3BlobStore;
import cal.prim.time.UnreliableWallClock;
import cal.sync.impls.GitCommandLine;
import cal.sync.impls.GitInfoExclude;
import cal.sync.impls.JsonManifestFormat;
import cal.sync.impls.Manifest;
import cal.sync.impls.OffloadEngine;
import cal.sync.impls.PointerCodec;
import cal.sync.impls.RestoreEngine;
import cal.sync.impls.SyncCoordinator;
import cal.sync.impls.SyncStatusFile;
import cal.sync.types.Config;
import cal.sync.types.FileRecord;
import cal.sync.types.FileVersion;
import cal.sync.types.LinkingStep;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

public class Main {

  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  private static void showHelp(Options options) {
    new HelpFormatter().printHelp("lfs-sync [options]", options);
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption("c", "config", true, "Config file (default ~/" + ConfigLoader.DEFAULT_CONFIG_FILE_NAME + ")");

    // actions; with none given, run the sync daemon
    options.addOption(Option.builder().longOpt("restore").desc("Restore every offloaded file, then exit").build());
    options.addOption(Option.builder().longOpt("offload").desc("Offload large files once, then exit").build());
    options.addOption(Option.builder().longOpt("cycle").desc("Run one sync cycle, then exit").build());
    options.addOption(Option.builder().longOpt("list").desc("Show the offloaded files and their versions").build());
    options.addOption(Option.builder().longOpt("forget").hasArg().argName("path")
            .desc("Drop a path from the manifest and delete its stored versions").build());

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println("Failed to parse options: " + e);
      showHelp(options);
      System.exit(1);
      return;
    }

    if (cli.hasOption('h')) {
      showHelp(options);
      return;
    }

    final ConfigLoader loader = ConfigLoader.fromSystem();
    final Config config;
    try {
      config = loader.load(cli.hasOption('c') ? Paths.get(cli.getOptionValue('c')) : null);
    } catch (ConfigLoader.ConfigException e) {
      System.err.println("Configuration error: " + e.getMessage());
      System.exit(1);
      return;
    }

    // ------------------------------------------------------------------------------
    // Set up actors

    final UnreliableWallClock clock = UnreliableWallClock.SYSTEM_CLOCK;
    final StopSignal stopSignal = new StopSignal();
    final Path repoDir = config.repoDir();
    final GitCommandLine git = new GitCommandLine(repoDir, config.branch());
    final GitInfoExclude exclusions = new GitInfoExclude(repoDir);
    final PointerCodec codec = new PointerCodec();
    final Manifest manifest = Manifest.load(repoDir, config.containerTag(), new JsonManifestFormat(), clock);

    @Nullable BlobStore store = null;
    if (config.offloadEnabled()) {
      try {
        store = openStore(config, stopSignal);
      } catch (IOException | RuntimeException e) {
        logger.error("Blob store unavailable; large files will not be offloaded", e);
      }
    }

    @Nullable OffloadEngine offload = null;
    @Nullable RestoreEngine restore = null;
    if (store != null) {
      offload = new OffloadEngine(repoDir, store, manifest, codec, git, exclusions, clock, config.workers());
      restore = new RestoreEngine(repoDir, store, manifest, codec, exclusions, clock, config.workers());
    }

    final SyncCoordinator coordinator = new SyncCoordinator(
            config, git, exclusions,
            offload, restore,
            LinkingStep.NONE,
            new SyncStatusFile(repoDir, clock),
            stopSignal, stopSignal);

    // ------------------------------------------------------------------------------
    // Do the work

    boolean oneShot = cli.hasOption("restore") || cli.hasOption("offload") || cli.hasOption("cycle")
            || cli.hasOption("list") || cli.hasOption("forget");
    boolean needsStore = cli.hasOption("restore") || cli.hasOption("offload") || cli.hasOption("forget");
    if (needsStore && (offload == null || restore == null)) {
      System.err.println("Large-file offload is disabled or the store is unavailable");
      System.exit(1);
      return;
    }

    if (cli.hasOption("list")) {
      Map<String, FileRecord> files = manifest.snapshot().files();
      if (files.isEmpty()) {
        System.out.println("No offloaded files.");
      }
      files.forEach((path, record) -> {
        System.out.println(path);
        for (FileVersion v : manifest.getAllVersions(path)) {
          String marker = v.hash().equals(record.currentHash()) ? "*" : " ";
          System.out.println("  " + marker + ' ' + v.timestamp() + "  " + Util.formatSize(v.size()) + "  " + v.assetName());
        }
      });
    }

    if (cli.hasOption("forget")) {
      String path = cli.getOptionValue("forget");
      int deleted = Objects.requireNonNull(offload).forget(path);
      System.out.println("Forgot " + path + " (" + deleted + " stored assets deleted)");
    }

    if (cli.hasOption("offload")) {
      Map<Path, Boolean> results = Objects.requireNonNull(offload).offloadLargeFiles(config.threshold(), config.excludes());
      offload.cleanupOldVersions(config.maxVersions());
      exitOnFailure(results);
    }

    if (cli.hasOption("restore")) {
      Map<Path, Boolean> results = Objects.requireNonNull(restore).restoreAll(repoDir, config.verifyHash(), (done, total) -> { });
      exitOnFailure(results);
    }

    if (cli.hasOption("cycle")) {
      coordinator.runCycle();
    }

    if (oneShot) {
      return;
    }

    Thread mainThread = Thread.currentThread();
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Shutdown requested");
      coordinator.stop();
      try {
        mainThread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "shutdown"));

    coordinator.run();
  }

  private static BlobStore openStore(Config config, StopSignal sleeper) throws IOException {
    switch (config.store()) {
      case GITHUB:
        return new GitHubReleaseStore(config.remoteRepo(), config.token(), sleeper);
      case S3: {
        S3ClientBuilder builder = S3Client.builder().credentialsProvider(DefaultCredentialsProvider.create());
        if (config.s3Region() != null) {
          builder.region(Region.of(config.s3Region()));
        }
        return new S3BlobStore(builder.build(), Objects.requireNonNull(config.s3Bucket()), sleeper);
      }
      case LOCAL:
        return new LocalBlobStore(Objects.requireNonNull(config.localStoreDir()));
      default:
        throw new IllegalArgumentException("unknown store " + config.store());
    }
  }

  private static void exitOnFailure(Map<Path, Boolean> results) {
    long failed = results.values().stream().filter(ok -> !ok).count();
    System.out.println((results.size() - failed) + "/" + results.size() + " succeeded");
    if (failed > 0) {
      System.exit(1);
    }
  }

}
