package cal.prim.storage;

import cal.prim.fs.AtomicFileOutputStream;
import cal.prim.fs.DurableFiles;
import cal.sync.Util;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A {@link BlobStore} on the local filesystem: one directory per container, one
 * file per asset.  Uploads are atomic and durable (see
 * {@link AtomicFileOutputStream}), so neither a concurrent reader nor a crash
 * ever sees a half-written asset.
 */
public class LocalBlobStore implements BlobStore {

  private final Path root;

  public LocalBlobStore(Path root) throws IOException {
    DurableFiles.createDirectories(root);
    this.root = root;
  }

  private static void checkName(String name) {
    if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
      throw new IllegalArgumentException("illegal name: '" + name + '\'');
    }
  }

  @Override
  public @Nullable Container findContainer(String tag) {
    checkName(tag);
    Path dir = root.resolve(tag);
    return Files.isDirectory(dir) ? new Container(tag, tag, dir.toString()) : null;
  }

  @Override
  public Container getOrCreateContainer(String tag) throws IOException {
    checkName(tag);
    Path dir = root.resolve(tag);
    DurableFiles.createDirectories(dir);
    return new Container(tag, tag, dir.toString());
  }

  @Override
  public List<Asset> listAssets(Container container) throws IOException {
    Path dir = Path.of(container.locator());
    List<Asset> result = new ArrayList<>();
    try (Stream<Path> entries = Files.list(dir)) {
      for (Path p : (Iterable<Path>) entries::iterator) {
        String name = p.getFileName().toString();
        if (Files.isRegularFile(p) && !AtomicFileOutputStream.isTemporary(p)) {
          result.add(new Asset(container.tag(), name, Files.size(p), p.toString()));
        }
      }
    } catch (NoSuchFileException e) {
      throw new StoreException(404, "container " + container.tag() + " does not exist", e);
    }
    return result;
  }

  @Override
  public @Nullable Asset findAsset(Container container, String name) throws IOException {
    checkName(name);
    Path p = Path.of(container.locator()).resolve(name);
    return Files.isRegularFile(p) ? new Asset(container.tag(), name, Files.size(p), p.toString()) : null;
  }

  @Override
  public Asset upload(Container container, String name, Path source, TransferListener listener) throws IOException {
    checkName(name);
    Path dst = Path.of(container.locator()).resolve(name);
    Files.deleteIfExists(dst);
    long total = Files.size(source);
    try (InputStream in = Files.newInputStream(source);
         AtomicFileOutputStream out = new AtomicFileOutputStream(dst)) {
      copy(in, out, total, listener);
      out.commit();
    }
    return new Asset(container.tag(), name, total, dst.toString());
  }

  @Override
  public void download(Asset asset, Path destination, TransferListener listener) throws IOException {
    Path src = Path.of(asset.locator());
    if (!Files.isRegularFile(src)) {
      throw new StoreException(404, "asset " + asset.name() + " does not exist");
    }
    try (InputStream in = Files.newInputStream(src);
         OutputStream out = Files.newOutputStream(destination)) {
      copy(in, out, asset.size(), listener);
    }
  }

  @Override
  public void delete(Asset asset) throws IOException {
    Files.deleteIfExists(Path.of(asset.locator()));
  }

  private static void copy(InputStream in, OutputStream out, long total, TransferListener listener) throws IOException {
    byte[] buf = new byte[Util.SUGGESTED_BUFFER_SIZE];
    long done = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      done += n;
      listener.onProgress(done, total);
    }
  }

}
