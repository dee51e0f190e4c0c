package ephemera.sweep;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BlobPathsTest {

  @Test
  void takesEverythingAfterBucketSegment() {
    assertEquals(Optional.of("user-1/1714557600.m4a"), BlobPaths.extract(
        "https://x.supabase.co/storage/v1/object/public/audio/user-1/1714557600.m4a", "audio"));
  }

  @Test
  void queryStringIsNotPartOfPath() {
    assertEquals(Optional.of("a.m4a"), BlobPaths.extract("https://h/audio/a.m4a?token=abc", "audio"));
  }

  @Test
  void missingSegment() {
    assertTrue(BlobPaths.extract("https://h/video/a.mp4", "audio").isEmpty());
    assertTrue(BlobPaths.extract("https://h/audiofiles/a.m4a", "audio").isEmpty());
  }

  @Test
  void repeatedSegmentIsAmbiguous() {
    assertTrue(BlobPaths.extract("https://h/audio/u1/audio/a.m4a", "audio").isEmpty());
  }

  @Test
  void adjacentSegmentsAreNotRepeats() {
    assertEquals(Optional.of("audio/a.m4a"), BlobPaths.extract("https://h/audio/audio/a.m4a", "audio"));
  }

  @Test
  void nothingAfterSegment() {
    assertTrue(BlobPaths.extract("https://h/audio/", "audio").isEmpty());
  }

  @Test
  void unparseableUrl() {
    assertTrue(BlobPaths.extract("https://h/audio/a b^.m4a", "audio").isEmpty());
    assertTrue(BlobPaths.extract("mailto:someone@example.com", "audio").isEmpty());
    assertTrue(BlobPaths.extract(null, "audio").isEmpty());
  }

  @Test
  void customBucket() {
    assertEquals(Optional.of("x/y.png"), BlobPaths.extract("https://h/storage/images/x/y.png", "images"));
  }
}
