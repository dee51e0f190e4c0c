package ephemera.jdbc;

import java.util.Objects;

/**
 * Table and column names used by the JDBC stores.
 *
 * <p>Names are interpolated into SQL, so each must be a plain identifier.
 *
 * @param content      content item table
 * @param likes        like edge table
 * @param comments     comment edge table
 * @param parentColumn column in both edge tables referencing the content item id
 */
public record TableNames(String content, String likes, String comments, String parentColumn) {
  public static final TableNames DEFAULT =
      new TableNames("content_item", "content_like", "content_comment", "item_id");

  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(content);
    validate(likes);
    validate(comments);
    validate(parentColumn);
  }

  public static String validate(String name) {
    Objects.requireNonNull(name, "name");
    if (!name.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid table or column name: " + name);
    }
    return name;
  }
}
