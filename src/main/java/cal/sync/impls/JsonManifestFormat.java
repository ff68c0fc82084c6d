package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.sync.types.FileRecord;
import cal.sync.types.FileVersion;
import cal.sync.types.ManifestContents;
import cal.sync.types.ManifestFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.checker.nullness.qual.PolyNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manifest format version 2:
 * <pre>
 * {
 *   "version": 2,
 *   "last_updated": "2026-01-02T03:04:05Z",
 *   "release_tag": "large-files-v1",
 *   "files": {
 *     "data/model.bin": {
 *       "current_hash": "sha256:...",
 *       "versions": [
 *         {"hash": "sha256:...", "asset_name": "...", "size": 1, "timestamp": "...", "uploaded": true}
 *       ]
 *     }
 *   }
 * }
 * </pre>
 * Timestamps are UTC with second precision.  Unknown properties are ignored.
 */
public class JsonManifestFormat implements ManifestFormat {

  public static final int VERSION = 2;

  private static class JsonVersion {
    public @Nullable String hash;
    @JsonProperty("asset_name")
    public @Nullable String assetName;
    public long size;
    public @Nullable String timestamp;
    public boolean uploaded = true;
  }

  private static class JsonRecord {
    @JsonProperty("current_hash")
    public @Nullable String currentHash;
    public @Nullable List<JsonVersion> versions;
  }

  private static class JsonManifest {
    public int version = VERSION;
    @JsonProperty("last_updated")
    public @Nullable String lastUpdated;
    @JsonProperty("release_tag")
    public @Nullable String releaseTag;
    public @Nullable Map<String, JsonRecord> files;
  }

  private final ObjectMapper mapper;

  public JsonManifestFormat() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
  }

  static String formatInstant(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  private static @PolyNull Instant parseInstant(@PolyNull String text) throws MalformedDataException {
    if (text == null) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      throw new MalformedDataException("Bad timestamp '" + text + '\'', e);
    }
  }

  @Override
  public ManifestContents load(InputStream data) throws IOException, MalformedDataException {
    final JsonManifest m;
    try {
      m = mapper.readValue(data, JsonManifest.class);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Manifest is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Manifest JSON is not well-formed", e);
    }
    if (m == null) {
      throw new MalformedDataException("Manifest is empty");
    }
    if (m.version > VERSION) {
      throw new MalformedDataException("Manifest version " + m.version + " is newer than supported version " + VERSION);
    }
    String tag = m.releaseTag;
    if (tag == null) {
      throw new MalformedDataException("Manifest has no release_tag");
    }

    ImmutableMap.Builder<String, FileRecord> files = ImmutableMap.builder();
    if (m.files != null) {
      for (Map.Entry<String, JsonRecord> entry : m.files.entrySet()) {
        String path = entry.getKey();
        JsonRecord r = entry.getValue();
        if (r == null || r.currentHash == null) {
          throw new MalformedDataException("File " + path + " has no current_hash");
        }
        ImmutableList.Builder<FileVersion> versions = ImmutableList.builder();
        for (JsonVersion v : r.versions != null ? r.versions : List.<JsonVersion>of()) {
          if (v.hash == null || v.assetName == null || v.timestamp == null) {
            throw new MalformedDataException("Incomplete version for " + path);
          }
          versions.add(new FileVersion(v.hash, v.assetName, v.size, parseInstant(v.timestamp), v.uploaded));
        }
        files.put(path, new FileRecord(r.currentHash, versions.build()));
      }
    }
    return new ManifestContents(tag, parseInstant(m.lastUpdated), files.build());
  }

  @Override
  public void serialize(ManifestContents contents, Instant lastUpdated, OutputStream out) throws IOException {
    JsonManifest m = new JsonManifest();
    m.lastUpdated = formatInstant(lastUpdated);
    m.releaseTag = contents.containerTag();
    m.files = new LinkedHashMap<>();
    for (Map.Entry<String, FileRecord> entry : contents.files().entrySet()) {
      JsonRecord r = new JsonRecord();
      r.currentHash = entry.getValue().currentHash();
      r.versions = new ArrayList<>();
      for (FileVersion v : entry.getValue().versions()) {
        JsonVersion jv = new JsonVersion();
        jv.hash = v.hash();
        jv.assetName = v.assetName();
        jv.size = v.size();
        jv.timestamp = formatInstant(v.timestamp());
        jv.uploaded = v.uploaded();
        r.versions.add(jv);
      }
      m.files.put(entry.getKey(), r);
    }
    mapper.writeValue(out, m);
  }

}
