package ephemera.blob;

import ephemera.spi.BlobStore;
import ephemera.spi.BlobStoreException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BlobStore} that deletes objects through an object-storage REST API.
 *
 * <p>Sends {@code DELETE <endpoint>/<bucket>/<path>} with the service key as bearer token and
 * {@code apikey} header, which is what Supabase Storage expects at
 * {@code https://<project>.supabase.co/storage/v1/object}. A 404 response means the object is
 * already gone and counts as success.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class HttpBlobStore implements BlobStore {
  private static final Logger logger = Logger.getLogger(HttpBlobStore.class.getName());
  private static final int MAX_BODY_IN_MESSAGE = 200;

  private final URI endpoint;
  private final String bucket;
  private final String serviceKey;
  private final Duration requestTimeout;
  private final HttpClient httpClient;

  private HttpBlobStore(Builder builder) {
    Objects.requireNonNull(builder.endpoint, "endpoint");
    this.bucket = Objects.requireNonNull(builder.bucket, "bucket");
    if (bucket.isEmpty() || bucket.contains("/")) {
      throw new IllegalArgumentException("bucket must be a single non-empty path segment");
    }
    this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be > 0");
    }
    String base = builder.endpoint.toString();
    this.endpoint = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
    this.serviceKey = builder.serviceKey;
    this.httpClient = builder.httpClient != null
        ? builder.httpClient
        : HttpClient.newBuilder().connectTimeout(requestTimeout).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void delete(String path) {
    Objects.requireNonNull(path, "path");
    URI target = objectUri(path);
    HttpRequest.Builder request = HttpRequest.newBuilder(target)
        .timeout(requestTimeout)
        .DELETE();
    if (serviceKey != null && !serviceKey.isEmpty()) {
      request.header("Authorization", "Bearer " + serviceKey);
      request.header("apikey", serviceKey);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new BlobStoreException("Blob delete request to " + target + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BlobStoreException("Interrupted while deleting blob " + path, e);
    }

    int status = response.statusCode();
    if (status == 404) {
      logger.log(Level.FINE, "Blob {0} already absent", path);
      return;
    }
    if (status < 200 || status >= 300) {
      throw new BlobStoreException("Blob delete returned HTTP " + status + ": " + abbreviate(response.body()));
    }
    logger.log(Level.FINE, "Deleted blob {0}", path);
  }

  URI objectUri(String path) {
    StringBuilder uri = new StringBuilder(endpoint.toString()).append('/').append(encode(bucket));
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        uri.append('/').append(encode(segment));
      }
    }
    return URI.create(uri.toString());
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
  }

  /** Builder for {@link HttpBlobStore}. */
  public static final class Builder {
    private URI endpoint;
    private String bucket = "audio";
    private String serviceKey;
    private Duration requestTimeout = Duration.ofSeconds(10);
    private HttpClient httpClient;

    private Builder() {}

    /** <b>Required.</b> Object API root, e.g. {@code https://x.supabase.co/storage/v1/object}. */
    public Builder endpoint(URI endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder endpoint(String endpoint) {
      return endpoint(URI.create(endpoint));
    }

    /** Optional. Defaults to {@code "audio"}. */
    public Builder bucket(String bucket) {
      this.bucket = bucket;
      return this;
    }

    /** Optional. Sent as bearer token and {@code apikey} header when set. */
    public Builder serviceKey(String serviceKey) {
      this.serviceKey = serviceKey;
      return this;
    }

    /** Optional. Defaults to 10 seconds. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /** Optional. A client built from {@code requestTimeout} is used by default. */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public HttpBlobStore build() {
      return new HttpBlobStore(this);
    }
  }
}
