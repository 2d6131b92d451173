package io.caresync.model;

/**
 * Fixed set of care appointment kinds.
 */
public enum ScheduleCategory {
  HOSPITAL("hospital"),
  REHABILITATION("rehabilitation"),
  THERAPY("therapy"),
  CHECKUP("checkup");

  private final String code;

  ScheduleCategory(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a category from its storage code.
   *
   * @throws IllegalArgumentException for unknown codes
   */
  public static ScheduleCategory fromCode(String code) {
    for (ScheduleCategory category : values()) {
      if (category.code.equalsIgnoreCase(code)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown schedule category: " + code);
  }
}
