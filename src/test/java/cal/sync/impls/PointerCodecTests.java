package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.sync.types.PointerFile;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class PointerCodecTests {

  private static final String HASH = "sha256:" + "ab".repeat(32);
  private static final PointerFile POINTER = new PointerFile(1, HASH, 1234, "model.bin", "large-files-v1", "abababababab-model.bin");

  private final PointerCodec codec = new PointerCodec();
  private Path dir;

  @BeforeMethod
  public void setup() throws IOException {
    dir = Files.createTempDirectory("pointers");
  }

  private PointerFile parse(String json) throws IOException, MalformedDataException {
    return codec.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
  }

  @Test
  public void testWireFormat() throws IOException, MalformedDataException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(POINTER, out);
    String json = out.toString(StandardCharsets.UTF_8);
    Assert.assertTrue(json.contains("\"type\" : \"lfs-pointer\""), json);
    Assert.assertTrue(json.contains("\"release_tag\" : \"large-files-v1\""), json);
    Assert.assertTrue(json.contains("\"asset_name\" : \"abababababab-model.bin\""), json);
    Assert.assertEquals(parse(json), POINTER);
  }

  @Test
  public void testReadIgnoresUnknownFieldsAndDefaultsVersion() throws IOException, MalformedDataException {
    PointerFile p = parse("{\"type\":\"lfs-pointer\",\"hash\":\"" + HASH + "\",\"size\":1234,"
            + "\"filename\":\"model.bin\",\"release_tag\":\"large-files-v1\","
            + "\"asset_name\":\"abababababab-model.bin\",\"extra\":[1,2]}");
    Assert.assertEquals(p, POINTER);
  }

  @Test(expectedExceptions = MalformedDataException.class)
  public void testNotJson() throws IOException, MalformedDataException {
    parse("this is not json");
  }

  @Test(expectedExceptions = MalformedDataException.class)
  public void testWrongType() throws IOException, MalformedDataException {
    parse("{\"type\":\"something-else\",\"hash\":\"" + HASH + "\"}");
  }

  @Test(expectedExceptions = MalformedDataException.class)
  public void testMissingField() throws IOException, MalformedDataException {
    parse("{\"type\":\"lfs-pointer\",\"hash\":\"" + HASH + "\",\"size\":1}");
  }

  @Test
  public void testValidate() throws MalformedDataException {
    PointerCodec.validate(POINTER);
    for (PointerFile bad : new PointerFile[] {
            new PointerFile(1, "md5:abc", 1, "f", "t", "a"),
            new PointerFile(1, HASH, 0, "f", "t", "a"),
            new PointerFile(1, HASH, 1, "", "t", "a"),
            new PointerFile(1, HASH, 1, "f", "", "a"),
            new PointerFile(1, HASH, 1, "f", "t", ""),
    }) {
      Assert.assertThrows(MalformedDataException.class, () -> PointerCodec.validate(bad));
    }
  }

  @Test
  public void testIsPointer() throws IOException {
    Path named = dir.resolve("x.bin.pointer");
    Files.writeString(named, "anything at all");
    Assert.assertTrue(codec.isPointer(named));

    Path marker = dir.resolve("marker.json");
    codec.write(marker, POINTER);
    Assert.assertTrue(codec.isPointer(marker));

    Path mentions = dir.resolve("notes.txt");
    Files.writeString(mentions, "this file talks about lfs-pointer files");
    Assert.assertFalse(codec.isPointer(mentions));

    Path big = dir.resolve("big.json");
    Files.writeString(big, "{\"type\":\"lfs-pointer\",\"pad\":\"" + "x".repeat(3000) + "\"}");
    Assert.assertFalse(codec.isPointer(big));

    Assert.assertFalse(codec.isPointer(dir.resolve("missing.pointer")));
    Assert.assertFalse(codec.isPointer(dir));
  }

  @Test
  public void testWriteCreatesParents() throws IOException, MalformedDataException {
    Path p = dir.resolve("a/b/c.bin.pointer");
    codec.write(p, POINTER);
    Assert.assertEquals(codec.read(p), POINTER);
  }

  @Test
  public void testRewriteReplacesPointerWithoutLeftovers() throws IOException, MalformedDataException {
    Path p = dir.resolve("c.bin.pointer");
    codec.write(p, POINTER);
    PointerFile moved = new PointerFile(1, HASH, 1234, "model.bin", "large-files-v2", "abababababab-model.bin");
    codec.write(p, moved);
    Assert.assertEquals(codec.read(p), moved);
    try (Stream<Path> files = Files.list(dir)) {
      Assert.assertEquals(files.collect(Collectors.toList()), List.of(p));
    }
  }

  @Test
  public void testPaths() {
    Assert.assertEquals(PointerCodec.realPath(Paths.get("a/b.bin.pointer")), Paths.get("a/b.bin"));
    Assert.assertEquals(PointerCodec.realPath(Paths.get("a/marker.json")), Paths.get("a/marker.json"));
    Assert.assertEquals(PointerCodec.realPath(Paths.get(".pointer")), Paths.get(".pointer"));
    Assert.assertEquals(PointerCodec.pointerPath(Paths.get("a/b.bin")), Paths.get("a/b.bin.pointer"));
  }

}
