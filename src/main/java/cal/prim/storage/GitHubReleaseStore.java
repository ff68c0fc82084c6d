package cal.prim.storage;

import cal.prim.RetryPolicy;
import cal.prim.time.Sleeper;
import cal.sync.Util;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link BlobStore} backed by GitHub releases.  A container is the release with
 * a given tag (created on demand); its assets are the release assets.
 *
 * <p>Every request goes through a {@link RetryPolicy} classified by
 * {@link StoreException#classify(IOException)}.  Asset downloads are redirected by
 * GitHub to a storage host; the redirect is followed by hand so that the
 * <code>Authorization</code> header is not sent there.
 */
public class GitHubReleaseStore implements BlobStore {

  private static final Logger logger = LoggerFactory.getLogger(GitHubReleaseStore.class);

  private static final URI GITHUB_API = URI.create("https://api.github.com");
  private static final int PAGE_SIZE = 100;
  private static final int CONNECT_TIMEOUT_MILLIS = 30_000;
  private static final int READ_TIMEOUT_MILLIS = 300_000;
  private static final int MAX_REDIRECTS = 5;

  private static class JsonRelease {
    public long id;
    public @Nullable String tag_name;
    public @Nullable String upload_url;
  }

  private static class JsonAsset {
    public long id;
    public @Nullable String name;
    public long size;
    public @Nullable String url;
  }

  private final String apiBase;
  private final String repo;
  private final String token;
  private final RetryPolicy retry;
  private final ObjectMapper mapper;

  /**
   * @param repo the repository, as <code>owner/name</code>
   * @param token a token with permission to manage releases
   * @param sleeper used for retry backoff
   */
  public GitHubReleaseStore(String repo, String token, Sleeper sleeper) {
    this(GITHUB_API, repo, token, RetryPolicy.exponential(StoreException::classify, sleeper));
  }

  GitHubReleaseStore(URI apiBase, String repo, String token, RetryPolicy retry) {
    this.apiBase = apiBase.toString().replaceAll("/$", "");
    this.repo = repo;
    this.token = token;
    this.retry = retry;
    this.mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private String repoUrl(String suffix) {
    return apiBase + "/repos/" + repo + suffix;
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }

  private HttpURLConnection open(String method, String url, boolean authorized) throws IOException {
    HttpURLConnection c = (HttpURLConnection) URI.create(url).toURL().openConnection();
    c.setRequestMethod(method);
    c.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
    c.setReadTimeout(READ_TIMEOUT_MILLIS);
    c.setInstanceFollowRedirects(false);
    c.setRequestProperty("Accept", "application/vnd.github.v3+json");
    if (authorized) {
      c.setRequestProperty("Authorization", "token " + token);
    }
    return c;
  }

  private static String readError(HttpURLConnection c) {
    try (InputStream err = c.getErrorStream()) {
      return err == null ? "" : new String(err.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      return "(unreadable response body: " + e + ')';
    }
  }

  /**
   * Read the response code, mapping transport failures to status 0.
   */
  private static int status(HttpURLConnection c, String what) throws StoreException {
    try {
      return c.getResponseCode();
    } catch (IOException e) {
      throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " failed: " + e, e);
    }
  }

  private static StoreException failure(HttpURLConnection c, int code, String what) {
    return new StoreException(code, what + " failed with HTTP " + code + ": " + readError(c));
  }

  /**
   * Issue one JSON request (no retry).
   *
   * @return the response body, or null if the server said 404 and <code>absentOk</code>
   */
  private byte @Nullable [] send(String method, String url, byte @Nullable [] body, boolean absentOk) throws IOException {
    String what = method + ' ' + url;
    logger.debug("{}", what);
    HttpURLConnection c = open(method, url, true);
    try {
      if (body != null) {
        c.setDoOutput(true);
        c.setRequestProperty("Content-Type", "application/json");
        c.setFixedLengthStreamingMode(body.length);
        try (OutputStream out = c.getOutputStream()) {
          out.write(body);
        } catch (IOException e) {
          throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " failed: " + e, e);
        }
      }
      int code = status(c, what);
      if (code == 404 && absentOk) {
        return null;
      }
      if (code < 200 || code >= 300) {
        throw failure(c, code, what);
      }
      try (InputStream in = c.getInputStream()) {
        return in.readAllBytes();
      }
    } finally {
      c.disconnect();
    }
  }

  private <T> T parse(byte[] body, Class<T> type, String what) throws StoreException {
    try {
      return mapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new StoreException(502, "unparsable response to " + what, e);
    } catch (IOException e) {
      throw new StoreException(StoreException.TRANSPORT_FAILURE, "could not read response to " + what, e);
    }
  }

  private static Container toContainer(JsonRelease r, String tag) throws StoreException {
    String uploadUrl = r.upload_url;
    if (uploadUrl == null) {
      throw new StoreException(502, "release " + tag + " has no upload_url");
    }
    // The upload URL is an RFC 6570 template like ".../assets{?name,label}"
    int brace = uploadUrl.indexOf('{');
    return new Container(tag, Long.toString(r.id), brace >= 0 ? uploadUrl.substring(0, brace) : uploadUrl);
  }

  private static Asset toAsset(JsonAsset a, String tag) throws StoreException {
    String name = a.name;
    String url = a.url;
    if (name == null || url == null) {
      throw new StoreException(502, "asset " + a.id + " in release " + tag + " is missing its name or url");
    }
    return new Asset(tag, name, a.size, url);
  }

  @Override
  public @Nullable Container findContainer(String tag) throws IOException {
    String url = repoUrl("/releases/tags/" + encode(tag));
    byte[] body = retry.call("look up release " + tag, () -> send("GET", url, null, true));
    return body == null ? null : toContainer(parse(body, JsonRelease.class, url), tag);
  }

  @Override
  public Container getOrCreateContainer(String tag) throws IOException {
    Container existing = findContainer(tag);
    if (existing != null) {
      return existing;
    }
    logger.info("Creating release {} in {}", tag, repo);
    String url = repoUrl("/releases");
    byte[] request = mapper.writeValueAsBytes(Map.of(
            "tag_name", tag,
            "name", "LFS Storage - " + tag,
            "body", "Storage for large files offloaded from the sync repository"));
    try {
      byte[] body = retry.call("create release " + tag, () -> send("POST", url, request, false));
      return toContainer(parse(Objects.requireNonNull(body), JsonRelease.class, url), tag);
    } catch (StoreException e) {
      // 422 means someone else created the tag in the meantime
      if (e.status() == 422) {
        Container raced = findContainer(tag);
        if (raced != null) {
          return raced;
        }
      }
      throw e;
    }
  }

  @Override
  public List<Asset> listAssets(Container container) throws IOException {
    return listAssets(container, retry);
  }

  private List<Asset> listAssets(Container container, RetryPolicy policy) throws IOException {
    List<Asset> result = new ArrayList<>();
    for (int page = 1; ; ++page) {
      String url = repoUrl("/releases/" + container.id() + "/assets?per_page=" + PAGE_SIZE + "&page=" + page);
      byte[] body = policy.call("list assets of " + container.tag(), () -> send("GET", url, null, false));
      JsonAsset[] assets = parse(Objects.requireNonNull(body), JsonAsset[].class, url);
      for (JsonAsset a : assets) {
        result.add(toAsset(a, container.tag()));
      }
      if (assets.length < PAGE_SIZE) {
        return result;
      }
    }
  }

  @Override
  public Asset upload(Container container, String name, Path source, TransferListener listener) throws IOException {
    // A failed POST can leave a half-created asset behind, so each attempt
    // looks for one and deletes it.  Only the outer call retries.
    RetryPolicy single = RetryPolicy.once();
    return retry.call("upload " + name, () -> {
      for (Asset old : listAssets(container, single)) {
        if (old.name().equals(name)) {
          logger.info("Deleting existing asset {} before re-upload", name);
          delete(old, single);
        }
      }
      return uploadOnce(container, name, source, listener);
    });
  }

  private Asset uploadOnce(Container container, String name, Path source, TransferListener listener) throws IOException {
    String url = container.locator() + "?name=" + encode(name);
    String what = "POST " + url;
    long total = Files.size(source);
    HttpURLConnection c = open("POST", url, true);
    try {
      c.setDoOutput(true);
      c.setRequestProperty("Content-Type", "application/octet-stream");
      c.setFixedLengthStreamingMode(total);
      byte[] buf = new byte[Util.SUGGESTED_BUFFER_SIZE];
      long done = 0;
      try (InputStream in = Files.newInputStream(source)) {
        try (OutputStream out = c.getOutputStream()) {
          int n;
          while ((n = in.read(buf)) >= 0) {
            out.write(buf, 0, n);
            done += n;
            listener.onProgress(done, total);
          }
        } catch (IOException e) {
          throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " failed after " + done + " bytes: " + e, e);
        }
      }
      int code = status(c, what);
      if (code < 200 || code >= 300) {
        throw failure(c, code, what);
      }
      byte[] body;
      try (InputStream in = c.getInputStream()) {
        body = in.readAllBytes();
      }
      Asset stored = toAsset(parse(body, JsonAsset.class, url), container.tag());
      logger.info("Uploaded {} as {} ({})", source.getFileName(), stored.name(), Util.formatSize(total));
      return stored;
    } finally {
      c.disconnect();
    }
  }

  @Override
  public void download(Asset asset, Path destination, TransferListener listener) throws IOException {
    retry.call("download " + asset.name(), () -> {
      downloadOnce(asset, destination, listener);
      return null;
    });
  }

  private void downloadOnce(Asset asset, Path destination, TransferListener listener) throws IOException {
    String url = asset.locator();
    boolean authorized = true;
    for (int hops = 0; hops <= MAX_REDIRECTS; ++hops) {
      String what = "GET " + (authorized ? url : "(redirect for " + asset.name() + ')');
      HttpURLConnection c = open("GET", url, authorized);
      try {
        c.setRequestProperty("Accept", "application/octet-stream");
        int code = status(c, what);
        if (code >= 300 && code < 400) {
          String location = c.getHeaderField("Location");
          if (location == null) {
            throw new StoreException(502, what + " redirected without a Location header");
          }
          url = URI.create(url).resolve(location).toString();
          // Pre-signed storage URLs reject (and must not see) the API token
          authorized = false;
          continue;
        }
        if (code < 200 || code >= 300) {
          throw failure(c, code, what);
        }
        long total = c.getContentLengthLong() >= 0 ? c.getContentLengthLong() : asset.size();
        byte[] buf = new byte[Util.SUGGESTED_BUFFER_SIZE];
        long done = 0;
        try (InputStream in = c.getInputStream();
             OutputStream out = Files.newOutputStream(destination)) {
          int n;
          while ((n = readFromNetwork(in, buf, what)) >= 0) {
            out.write(buf, 0, n);
            done += n;
            listener.onProgress(done, total);
          }
        }
        if (total >= 0 && done != total) {
          throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " ended after " + done + " of " + total + " bytes");
        }
        return;
      } finally {
        c.disconnect();
      }
    }
    throw new StoreException(502, "too many redirects downloading " + asset.name());
  }

  private static int readFromNetwork(InputStream in, byte[] buf, String what) throws StoreException {
    try {
      return in.read(buf);
    } catch (IOException e) {
      throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " failed: " + e, e);
    }
  }

  @Override
  public void delete(Asset asset) throws IOException {
    delete(asset, retry);
  }

  private void delete(Asset asset, RetryPolicy policy) throws IOException {
    policy.call("delete " + asset.name(), () -> send("DELETE", asset.locator(), null, true));
    logger.info("Deleted asset {} from release {}", asset.name(), asset.containerTag());
  }

}
