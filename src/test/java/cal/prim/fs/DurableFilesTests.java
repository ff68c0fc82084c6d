package cal.prim.fs;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class DurableFilesTests {

  private Path dir;

  @BeforeMethod
  public void setup() throws IOException {
    dir = Files.createTempDirectory("durable");
  }

  private List<String> names() throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }

  @Test
  public void testCommitReplacesTarget() throws IOException {
    Path target = dir.resolve("file.pointer");
    Files.writeString(target, "old", StandardCharsets.UTF_8);
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
      out.write("new".getBytes(StandardCharsets.UTF_8));
      Assert.assertEquals(Files.readString(target, StandardCharsets.UTF_8), "old");
      out.commit();
    }
    Assert.assertEquals(Files.readString(target, StandardCharsets.UTF_8), "new");
    Assert.assertEquals(names(), List.of("file.pointer"));
  }

  @Test
  public void testCloseWithoutCommitKeepsOldContents() throws IOException {
    Path target = dir.resolve("file.pointer");
    Files.writeString(target, "old", StandardCharsets.UTF_8);
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
      out.write("half of a new pointer".getBytes(StandardCharsets.UTF_8));
    }
    Assert.assertEquals(Files.readString(target, StandardCharsets.UTF_8), "old");
    Assert.assertEquals(names(), List.of("file.pointer"));
  }

  @Test
  public void testFailingWriterLeavesNoTrace() throws IOException {
    Path target = dir.resolve("manifest.json");
    IOException e = Assert.expectThrows(IOException.class, () -> {
      try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
        out.write('{');
        throw new IOException("serializer broke");
      }
    });
    Assert.assertEquals(e.getMessage(), "serializer broke");
    Assert.assertEquals(names(), List.of());
  }

  @Test
  public void testWritesAfterCommitAreRejected() throws IOException {
    Path target = dir.resolve("x");
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
      out.commit();
      Assert.assertThrows(IOException.class, () -> out.write(1));
    }
    Assert.assertEquals(Files.size(target), 0L);
  }

  @Test
  public void testTemporaryNames() throws IOException {
    Assert.assertTrue(AtomicFileOutputStream.isTemporary(Path.of(".model.bin123456.partial")));
    Assert.assertFalse(AtomicFileOutputStream.isTemporary(Path.of("model.bin.partial")));
    Assert.assertFalse(AtomicFileOutputStream.isTemporary(Path.of(".gitignore")));
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(dir.resolve("model.bin"))) {
      List<String> during = names();
      Assert.assertEquals(during.size(), 1);
      Assert.assertTrue(AtomicFileOutputStream.isTemporary(Path.of(during.get(0))));
    }
  }

  @Test
  public void testWrite() throws IOException {
    Path target = dir.resolve("status.json");
    DurableFiles.write(target, "{}".getBytes(StandardCharsets.UTF_8));
    DurableFiles.write(target, "{\"phase\":\"done\"}".getBytes(StandardCharsets.UTF_8));
    Assert.assertEquals(Files.readString(target, StandardCharsets.UTF_8), "{\"phase\":\"done\"}");
    Assert.assertEquals(names(), List.of("status.json"));
  }

  @Test
  public void testReplace() throws IOException {
    Path src = dir.resolve(".restored");
    Path dst = dir.resolve("model.bin");
    Files.writeString(src, "real bytes", StandardCharsets.UTF_8);
    Files.writeString(dst, "pointer", StandardCharsets.UTF_8);
    DurableFiles.replace(src, dst);
    Assert.assertEquals(Files.readString(dst, StandardCharsets.UTF_8), "real bytes");
    Assert.assertEquals(names(), List.of("model.bin"));
  }

  @Test
  public void testCreateDirectories() throws IOException {
    Path nested = dir.resolve("a").resolve("b").resolve("c");
    DurableFiles.createDirectories(nested);
    Assert.assertTrue(Files.isDirectory(nested));
    // idempotent
    DurableFiles.createDirectories(nested);
    DurableFiles.createDirectories(dir);
  }

  @Test
  public void testCreateDirectoriesOverFile() throws IOException {
    Path file = dir.resolve("a");
    Files.writeString(file, "in the way", StandardCharsets.UTF_8);
    Assert.assertThrows(FileAlreadyExistsException.class, () -> DurableFiles.createDirectories(file.resolve("b")));
  }

}
