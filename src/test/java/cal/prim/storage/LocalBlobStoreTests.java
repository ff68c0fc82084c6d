package cal.prim.storage;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class LocalBlobStoreTests {

  private Path root;
  private LocalBlobStore store;

  @BeforeMethod
  public void setup() throws IOException {
    root = Files.createTempDirectory("blobs");
    store = new LocalBlobStore(root);
  }

  private Path file(String content) throws IOException {
    Path p = Files.createTempFile("blob", ".bin");
    Files.writeString(p, content, StandardCharsets.UTF_8);
    return p;
  }

  @Test
  public void testContainers() throws IOException {
    Assert.assertNull(store.findContainer("v1"));
    Container c = store.getOrCreateContainer("v1");
    Assert.assertEquals(c.tag(), "v1");
    Assert.assertEquals(store.getOrCreateContainer("v1"), c);
    Assert.assertEquals(store.findContainer("v1"), c);
    Assert.assertTrue(store.listAssets(c).isEmpty());
  }

  @Test
  public void testUploadDownloadDelete() throws IOException {
    Container c = store.getOrCreateContainer("v1");
    List<Long> progress = new ArrayList<>();
    Asset a = store.upload(c, "abc-file.bin", file("first"), (done, total) -> progress.add(done));
    Assert.assertEquals(a.name(), "abc-file.bin");
    Assert.assertEquals(a.size(), 5L);
    Assert.assertEquals(progress.get(progress.size() - 1).longValue(), 5L);

    // re-upload replaces
    Asset b = store.upload(c, "abc-file.bin", file("second!"), TransferListener.NONE);
    Assert.assertEquals(store.listAssets(c), List.of(b));
    Assert.assertEquals(store.findAsset(c, "abc-file.bin"), b);

    Path out = Files.createTempFile("out", ".bin");
    store.download(b, out, TransferListener.NONE);
    Assert.assertEquals(Files.readString(out, StandardCharsets.UTF_8), "second!");

    store.delete(b);
    store.delete(b);
    Assert.assertNull(store.findAsset(c, "abc-file.bin"));
    StoreException e = Assert.expectThrows(StoreException.class, () -> store.download(b, out, TransferListener.NONE));
    Assert.assertTrue(e.isNotFound());
  }

  @Test
  public void testPartialUploadsAreInvisible() throws IOException {
    Container c = store.getOrCreateContainer("v1");
    Files.writeString(root.resolve("v1").resolve(".x.bin123.partial"), "half");
    Assert.assertTrue(store.listAssets(c).isEmpty());
  }

  @Test
  public void testIllegalNames() {
    Assert.assertThrows(IllegalArgumentException.class, () -> store.getOrCreateContainer("../escape"));
    Assert.assertThrows(IllegalArgumentException.class, () -> store.findContainer(".."));
  }

}
