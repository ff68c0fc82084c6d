package cal.prim.storage;

import cal.prim.RetryPolicy;
import cal.prim.time.Sleeper;
import cal.sync.Util;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link BlobStore} in one S3 bucket.  A container is the key prefix
 * <code>&lt;tag&gt;/</code>; since S3 has no real directories, a container "exists"
 * as soon as the bucket does.
 */
public class S3BlobStore implements BlobStore {

  private static final Logger logger = LoggerFactory.getLogger(S3BlobStore.class);

  private final S3Client s3client;
  private final String bucket;
  private final RetryPolicy retry;
  private boolean bucketChecked;

  public S3BlobStore(S3Client s3client, String bucketName, Sleeper sleeper) {
    this.s3client = s3client;
    this.bucket = bucketName;
    this.retry = RetryPolicy.exponential(StoreException::classify, sleeper);
    this.bucketChecked = false;
  }

  /**
   * Run an SDK call, translating its unchecked exceptions into {@link StoreException}s
   * so the retry classifier can see the status code.
   */
  private <T> T sdk(String what, RetryPolicy.Action<T> action) throws IOException {
    return retry.call(what, () -> {
      try {
        return action.run();
      } catch (S3Exception e) {
        throw new StoreException(e.statusCode(), what + " failed: " + e.getMessage(), e);
      } catch (SdkClientException e) {
        // "SdkClientException" indicates any other kind of error, including:
        //   - malformed request
        //   - network error
        //   - unable to parse response from Amazon
        throw new StoreException(StoreException.TRANSPORT_FAILURE, what + " failed: " + e.getMessage(), e);
      }
    });
  }

  private synchronized void ensureBucket() throws IOException {
    if (bucketChecked) {
      return;
    }
    sdk("check bucket " + bucket, () -> {
      try {
        s3client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      } catch (NoSuchBucketException e) {
        logger.info("Creating bucket {}", bucket);
        s3client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      }
      return null;
    });
    bucketChecked = true;
  }

  private static String prefix(String tag) {
    return tag + '/';
  }

  @Override
  public @Nullable Container findContainer(String tag) throws IOException {
    return getOrCreateContainer(tag);
  }

  @Override
  public Container getOrCreateContainer(String tag) throws IOException {
    ensureBucket();
    return new Container(tag, tag, prefix(tag));
  }

  @Override
  public List<Asset> listAssets(Container container) throws IOException {
    ListObjectsV2Request request = ListObjectsV2Request.builder()
            .bucket(bucket)
            .prefix(container.locator())
            .build();
    List<Asset> result = new ArrayList<>();
    ListObjectsV2Response listing = sdk("list " + container.locator(), () -> s3client.listObjectsV2(request));
    while (true) {
      for (S3Object o : listing.contents()) {
        String name = o.key().substring(container.locator().length());
        if (!name.isEmpty() && !name.contains("/")) {
          result.add(new Asset(container.tag(), name, o.size(), o.key()));
        }
      }
      if (!Boolean.TRUE.equals(listing.isTruncated())) {
        return result;
      }
      String token = listing.nextContinuationToken();
      listing = sdk("list " + container.locator(), () -> s3client.listObjectsV2(request.toBuilder()
              .continuationToken(token)
              .build()));
    }
  }

  // TODO: single PUTs are capped at 5 GB; switch to multipart uploads for larger files
  @Override
  public Asset upload(Container container, String name, Path source, TransferListener listener) throws IOException {
    String key = container.locator() + name;
    long total = Files.size(source);
    return sdk("upload " + key, () -> {
      s3client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      s3client.putObject(
              PutObjectRequest.builder()
                      .bucket(bucket)
                      .key(key)
                      .contentLength(total)
                      .contentType("application/octet-stream")
                      .build(),
              RequestBody.fromContentProvider(
                      () -> new ProgressReportingInputStream(openUnchecked(source), total, listener),
                      total,
                      "application/octet-stream"));
      logger.info("Uploaded {} to s3://{}/{} ({})", source.getFileName(), bucket, key, Util.formatSize(total));
      return new Asset(container.tag(), name, total, key);
    });
  }

  private static InputStream openUnchecked(Path source) {
    try {
      return Util.buffered(Files.newInputStream(source));
    } catch (IOException e) {
      throw SdkClientException.create("cannot read " + source, e);
    }
  }

  @Override
  public void download(Asset asset, Path destination, TransferListener listener) throws IOException {
    ResponseTransformer<GetObjectResponse, Long> toFile = (response, in) -> {
      long done = 0;
      try (OutputStream out = Files.newOutputStream(destination)) {
        byte[] buf = new byte[Util.SUGGESTED_BUFFER_SIZE];
        int n;
        while ((n = in.read(buf)) >= 0) {
          out.write(buf, 0, n);
          done += n;
          listener.onProgress(done, asset.size());
        }
      }
      return done;
    };
    GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(asset.locator()).build();
    sdk("download " + asset.locator(), () -> s3client.getObject(request, toFile));
  }

  @Override
  public void delete(Asset asset) throws IOException {
    sdk("delete " + asset.locator(), () -> s3client.deleteObject(
            DeleteObjectRequest.builder().bucket(bucket).key(asset.locator()).build()));
    logger.info("Deleted s3://{}/{}", bucket, asset.locator());
  }

  private static class ProgressReportingInputStream extends FilterInputStream {
    private final long total;
    private final TransferListener listener;
    private long done;

    ProgressReportingInputStream(InputStream in, long total, TransferListener listener) {
      super(in);
      this.total = total;
      this.listener = listener;
      this.done = 0;
    }

    @Override
    public int read() throws IOException {
      int b = super.read();
      if (b >= 0) {
        listener.onProgress(++done, total);
      }
      return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      int n = super.read(b, off, len);
      if (n > 0) {
        done += n;
        listener.onProgress(done, total);
      }
      return n;
    }
  }

}
