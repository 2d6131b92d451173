package io.caresync.model;

import java.util.Objects;

/**
 * One entry of a schedule's preparation checklist.
 */
public record ChecklistItem(String item, boolean checked) {

  public ChecklistItem {
    Objects.requireNonNull(item, "item");
  }

  public static ChecklistItem unchecked(String item) {
    return new ChecklistItem(item, false);
  }
}
