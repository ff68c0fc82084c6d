package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.prim.fs.AtomicFileOutputStream;
import cal.prim.fs.DurableFiles;
import cal.sync.types.PointerFile;
import cal.sync.types.Sha256AndSize;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes pointer files.
 *
 * <p>A pointer is a small JSON object:
 * <pre>
 * {
 *   "version": 1,
 *   "type": "lfs-pointer",
 *   "hash": "sha256:...",
 *   "size": 104857600,
 *   "filename": "model.bin",
 *   "release_tag": "large-files-v1",
 *   "asset_name": "0123456789ab-model.bin"
 * }
 * </pre>
 */
public class PointerCodec {

  private static final Logger logger = LoggerFactory.getLogger(PointerCodec.class);

  /** Files larger than this are never sniffed for pointer content. */
  static final long MAX_SNIFF_SIZE = 2048;

  private static class JsonPointer {
    public @Nullable Integer version;
    public @Nullable String type;
    public @Nullable String hash;
    public @Nullable Long size;
    public @Nullable String filename;
    @JsonProperty("release_tag")
    public @Nullable String releaseTag;
    @JsonProperty("asset_name")
    public @Nullable String assetName;
  }

  private final ObjectMapper mapper;

  public PointerCodec() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    // callers own the streams they pass in
    mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
  }

  /**
   * Decide whether a file is a pointer.  A file is a pointer if its name ends in
   * {@link PointerFile#SUFFIX}, or if it is small and holds a JSON object whose
   * <code>type</code> is {@link PointerFile#TYPE_MARKER}.  The second rule picks up
   * marker files that were written without the naming convention.
   *
   * @param path a path
   * @return true if the path is a regular file that looks like a pointer
   */
  public boolean isPointer(Path path) {
    if (!Files.isRegularFile(path)) {
      return false;
    }
    if (path.getFileName().toString().endsWith(PointerFile.SUFFIX)) {
      return true;
    }
    try {
      if (Files.size(path) > MAX_SNIFF_SIZE) {
        return false;
      }
      String content = Files.readString(path, StandardCharsets.UTF_8);
      if (!content.contains(PointerFile.TYPE_MARKER)) {
        return false;
      }
      JsonPointer p = mapper.readValue(content, JsonPointer.class);
      return PointerFile.TYPE_MARKER.equals(p.type);
    } catch (IOException e) {
      // unreadable, not UTF-8, or not a JSON object: not a pointer
      logger.debug("{} is not a pointer: {}", path, e.toString());
      return false;
    }
  }

  /**
   * Parse a pointer file.
   *
   * @param path the pointer file
   * @return its contents (not yet {@link #validate(PointerFile) validated})
   * @throws IOException if the file cannot be read
   * @throws MalformedDataException if the file is not JSON, is not marked as a
   *   pointer, or lacks a required field
   */
  public PointerFile read(Path path) throws IOException, MalformedDataException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.toString());
    }
  }

  PointerFile read(InputStream in, String description) throws IOException, MalformedDataException {
    final JsonPointer p;
    try {
      p = mapper.readValue(in, JsonPointer.class);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Pointer " + description + " is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Pointer " + description + " is not a JSON object", e);
    }
    if (p == null) {
      throw new MalformedDataException("Pointer " + description + " is empty");
    }
    if (!PointerFile.TYPE_MARKER.equals(p.type)) {
      throw new MalformedDataException("File " + description + " is not a pointer (type=" + p.type + ')');
    }
    return new PointerFile(
            p.version != null ? p.version : PointerFile.CURRENT_VERSION,
            require(p.hash, "hash", description),
            require(p.size, "size", description),
            require(p.filename, "filename", description),
            require(p.releaseTag, "release_tag", description),
            require(p.assetName, "asset_name", description));
  }

  private static <T> T require(@Nullable T value, String field, String description) throws MalformedDataException {
    if (value == null) {
      throw new MalformedDataException("Pointer " + description + " has no \"" + field + '"');
    }
    return value;
  }

  /**
   * Check that a pointer is complete enough to restore from.
   *
   * @param pointer a parsed pointer
   * @throws MalformedDataException describing the first problem found
   */
  public static void validate(PointerFile pointer) throws MalformedDataException {
    if (!pointer.hash().startsWith(Sha256AndSize.HASH_PREFIX)) {
      throw new MalformedDataException("hash '" + pointer.hash() + "' does not start with " + Sha256AndSize.HASH_PREFIX);
    }
    if (pointer.size() <= 0) {
      throw new MalformedDataException("size must be positive, was " + pointer.size());
    }
    if (pointer.filename().isEmpty()) {
      throw new MalformedDataException("filename is empty");
    }
    if (pointer.assetName().isEmpty()) {
      throw new MalformedDataException("asset name is empty");
    }
    if (pointer.containerTag().isEmpty()) {
      throw new MalformedDataException("release tag is empty");
    }
  }

  /**
   * Write (or overwrite) a pointer file, creating parent directories as needed.
   * The replacement is atomic and durable: a crash leaves either the old pointer
   * or the new one, never a truncated file.
   *
   * @param path where to write
   * @param pointer what to write
   * @throws IOException if writing fails; an existing pointer is then unchanged
   */
  public void write(Path path, PointerFile pointer) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      DurableFiles.createDirectories(parent);
    }
    try (AtomicFileOutputStream file = new AtomicFileOutputStream(path)) {
      OutputStream out = new BufferedOutputStream(file);
      write(pointer, out);
      out.flush();
      file.commit();
    }
  }

  void write(PointerFile pointer, OutputStream out) throws IOException {
    JsonPointer p = new JsonPointer();
    p.version = pointer.version();
    p.type = PointerFile.TYPE_MARKER;
    p.hash = pointer.hash();
    p.size = pointer.size();
    p.filename = pointer.filename();
    p.releaseTag = pointer.containerTag();
    p.assetName = pointer.assetName();
    mapper.writeValue(out, p);
  }

  /**
   * The file a pointer stands for: the pointer path without its suffix, or the
   * pointer path itself for a marker file written without the suffix.
   */
  public static Path realPath(Path pointerPath) {
    String name = pointerPath.getFileName().toString();
    if (name.endsWith(PointerFile.SUFFIX) && name.length() > PointerFile.SUFFIX.length()) {
      return pointerPath.resolveSibling(name.substring(0, name.length() - PointerFile.SUFFIX.length()));
    }
    return pointerPath;
  }

  public static Path pointerPath(Path realPath) {
    return realPath.resolveSibling(realPath.getFileName().toString() + PointerFile.SUFFIX);
  }

}
