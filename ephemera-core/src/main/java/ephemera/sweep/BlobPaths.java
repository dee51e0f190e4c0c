package ephemera.sweep;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Extracts a storage path from a public media URL of the form
 * {@code https://host/.../<bucket>/<path>}.
 */
public final class BlobPaths {

  private BlobPaths() {}

  /**
   * Returns everything after the {@code /<bucket>/} segment of the URL path.
   *
   * <p>Empty if the URL cannot be parsed, the segment is missing, the segment occurs more than
   * once, or nothing follows it.
   */
  public static Optional<String> extract(String mediaUrl, String bucket) {
    if (mediaUrl == null || mediaUrl.isEmpty() || bucket == null || bucket.isEmpty()) {
      return Optional.empty();
    }
    String path;
    try {
      path = new URI(mediaUrl).getPath();
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
    if (path == null) {
      return Optional.empty();
    }
    String marker = "/" + bucket + "/";
    int first = path.indexOf(marker);
    if (first < 0) {
      return Optional.empty();
    }
    int rest = first + marker.length();
    if (path.indexOf(marker, rest) >= 0) {
      return Optional.empty();
    }
    String blobPath = path.substring(rest);
    return blobPath.isEmpty() ? Optional.empty() : Optional.of(blobPath);
  }
}
