package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.sync.Util;
import cal.sync.types.FileVersion;
import cal.sync.types.PointerFile;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class OffloadEngineTests {

  static final String TAG = "large-files-v1";

  private Path repo;
  private CountingBlobStore store;
  private TestClock clock;
  private Manifest manifest;
  private FakeVersionControl vcs;
  private PointerCodec codec;
  private OffloadEngine engine;

  @BeforeMethod
  public void setup() throws IOException {
    repo = Files.createTempDirectory("offload-repo");
    store = new CountingBlobStore(Files.createTempDirectory("offload-store"));
    clock = new TestClock();
    manifest = Manifest.load(repo, TAG, new JsonManifestFormat(), clock);
    vcs = new FakeVersionControl();
    codec = new PointerCodec();
    engine = new OffloadEngine(repo, store, manifest, codec, vcs, new GitInfoExclude(repo), clock, 3);
  }

  private Path write(String rel, String content) throws IOException {
    Path p = repo.resolve(rel);
    Files.createDirectories(p.getParent());
    Files.writeString(p, content, StandardCharsets.UTF_8);
    return p;
  }

  @Test
  public void testLargeModelFile() throws IOException, InterruptedException, MalformedDataException {
    Path model = repo.resolve("model.bin");
    try (RandomAccessFile f = new RandomAccessFile(model.toFile(), "rw")) {
      f.setLength(100 * Util.ONE_MB);
    }
    write("small.txt", "hello");

    Map<Path, Boolean> results = engine.offloadLargeFiles(60 * Util.ONE_MB, List.of());
    Assert.assertEquals(results, Map.of(model, true));

    Path pointerPath = repo.resolve("model.bin.pointer");
    Assert.assertTrue(Files.exists(pointerPath));
    Assert.assertTrue(Files.exists(model), "real file must stay on disk");
    Assert.assertFalse(Files.exists(repo.resolve("small.txt.pointer")));

    PointerFile pointer = codec.read(pointerPath);
    Assert.assertTrue(pointer.hash().matches("sha256:[0-9a-f]{64}"), pointer.hash());
    Assert.assertEquals(pointer.size(), 104857600L);
    Assert.assertTrue(pointer.assetName().matches("[0-9a-f]{12}-model\\.bin"), pointer.assetName());
    Assert.assertEquals(pointer.containerTag(), TAG);
    Assert.assertEquals(pointer.filename(), "model.bin");
    Assert.assertTrue(Util.summarize(model).matches(pointer.hash()));

    List<FileVersion> versions = manifest.getAllVersions("model.bin");
    Assert.assertEquals(versions.size(), 1);
    Assert.assertEquals(versions.get(0).assetName(), pointer.assetName());
    Assert.assertTrue(Files.exists(manifest.location()));

    String excluded = Files.readString(repo.resolve(".git/info/exclude"), StandardCharsets.UTF_8);
    Assert.assertTrue(excluded.lines().anyMatch("model.bin"::equals), excluded);
  }

  @Test
  public void testOffloadIsIdempotent() throws IOException {
    Path file = write("data/blob.dat", "some content");
    Assert.assertTrue(engine.offload(file));
    Assert.assertTrue(engine.offload(file));
    Assert.assertEquals(store.uploads.get(), 1);
    Assert.assertEquals(manifest.getAllVersions("data/blob.dat").size(), 1);
  }

  @Test
  public void testOffloadUnstagesTrackedFile() throws IOException {
    Path file = write("big.iso", "pretend this is big");
    vcs.track("big.iso");
    Assert.assertTrue(engine.offload(file));
    Assert.assertTrue(vcs.events().contains("unstage:big.iso"), vcs.events().toString());
    Assert.assertTrue(engine.offload(file));
    Assert.assertEquals(vcs.events().stream().filter(e -> e.startsWith("unstage:")).count(), 1L);
  }

  @Test
  public void testNewContentAddsVersion() throws IOException, MalformedDataException {
    Path file = write("a.bin", "v1");
    Assert.assertTrue(engine.offload(file));
    clock.advance(Duration.ofMinutes(1));
    write("a.bin", "v2");
    Assert.assertTrue(engine.offload(file));

    Assert.assertEquals(store.uploads.get(), 2);
    List<FileVersion> versions = manifest.getAllVersions("a.bin");
    Assert.assertEquals(versions.size(), 2);
    PointerFile pointer = codec.read(repo.resolve("a.bin.pointer"));
    Assert.assertEquals(versions.get(0).hash(), pointer.hash());
    Assert.assertEquals(manifest.getCurrentVersion("a.bin"), versions.get(0));
  }

  @Test
  public void testRetentionDeletesEvictedAssets() throws IOException {
    Path file = repo.resolve("a.bin");
    for (int i = 0; i < 5; ++i) {
      write("a.bin", "content " + i);
      Assert.assertTrue(engine.offload(file));
      clock.advance(Duration.ofMinutes(1));
    }
    Assert.assertEquals(manifest.getAllVersions("a.bin").size(), 5);

    int deleted = engine.cleanupOldVersions(2);
    Assert.assertEquals(deleted, 3);
    Assert.assertEquals(store.deletes.get(), 3);

    List<FileVersion> remaining = manifest.getAllVersions("a.bin");
    Assert.assertEquals(remaining.size(), 2);
    Assert.assertTrue(Util.summarize(file).matches(remaining.get(0).hash()));
    var container = store.findContainer(TAG);
    Assert.assertNotNull(container);
    Assert.assertEquals(store.listAssets(container).size(), 2);

    Assert.assertEquals(engine.cleanupOldVersions(2), 0);
  }

  @Test
  public void testOneFailureDoesNotStopBatch() throws InterruptedException, IOException {
    Path good = write("good.bin", "fine");
    Path missing = repo.resolve("missing.bin");
    Map<Path, Boolean> results = engine.offloadAll(List.of(missing, good));
    Assert.assertEquals(results.get(missing), Boolean.FALSE);
    Assert.assertEquals(results.get(good), Boolean.TRUE);
    Assert.assertTrue(Files.exists(repo.resolve("good.bin.pointer")));
  }

  @Test
  public void testExcludedAndPointerFilesAreNotOffloaded() throws IOException, InterruptedException {
    write("cache/huge.bin", "0123456789");
    write("keep/huge.bin", "0123456789");
    Map<Path, Boolean> results = engine.offloadLargeFiles(5, List.of("cache"));
    Assert.assertEquals(results.keySet(), Set.of(repo.resolve("keep/huge.bin")));

    // the pointer and manifest written above are not candidates next time
    Map<Path, Boolean> again = engine.offloadLargeFiles(5, List.of("cache"));
    Assert.assertEquals(again.keySet(), Set.of(repo.resolve("keep/huge.bin")));
    Assert.assertEquals(store.uploads.get(), 1);
  }

  @Test
  public void testForget() throws IOException {
    Path file = write("old.bin", "bye");
    Assert.assertTrue(engine.offload(file));
    Assert.assertEquals(engine.forget("old.bin"), 1);
    Assert.assertNull(manifest.getFileRecord("old.bin"));
    Assert.assertEquals(store.deletes.get(), 1);
  }

}
