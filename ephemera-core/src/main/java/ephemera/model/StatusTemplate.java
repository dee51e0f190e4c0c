package ephemera.model;

import java.util.Optional;

/**
 * Built-in status presets.
 */
public enum StatusTemplate implements CanonicalTemplate {
  CAFE("cafe", "☕ カフェなう"),
  LUNCH("lunch", "🍴 ランチ中"),
  WALKING("walking", "🚶 散歩中"),
  STUDYING("studying", "📚 勉強中"),
  FREE("free", "😴 暇してる"),
  EVENT("event", "🎉 イベント参加中"),
  MOVING("moving", "🏃 移動中"),
  MOVIE("movie", "🎬 映画鑑賞中");

  private final String key;
  private final String canonicalText;

  StatusTemplate(String key, String canonicalText) {
    this.key = key;
    this.canonicalText = canonicalText;
  }

  @Override
  public String key() {
    return key;
  }

  @Override
  public String canonicalText() {
    return canonicalText;
  }

  public static Optional<StatusTemplate> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (StatusTemplate template : values()) {
      if (template.key.equals(key)) {
        return Optional.of(template);
      }
    }
    return Optional.empty();
  }
}
