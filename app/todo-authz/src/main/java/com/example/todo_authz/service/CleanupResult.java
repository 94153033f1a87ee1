package com.example.todo_authz.service;

import java.util.List;

/** ベストエフォートな後始末の結果。警告が空なら完全に片付いている。 */
public record CleanupResult(List<OwnershipWarning> warnings) {

  private static final CleanupResult OK = new CleanupResult(List.of());

  public CleanupResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static CleanupResult ok() {
    return OK;
  }

  public static CleanupResult of(List<OwnershipWarning> warnings) {
    return warnings == null || warnings.isEmpty() ? OK : new CleanupResult(warnings);
  }

  public boolean isClean() {
    return warnings.isEmpty();
  }
}
