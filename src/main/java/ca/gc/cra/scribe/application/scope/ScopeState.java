package ca.gc.cra.scribe.application.scope;

import java.util.Map;

/**
 * Explicit conversion of an application object into scope properties.
 *
 * <p>Implement this on request/context objects that should contribute named properties when passed to
 * {@code beginScope}. Objects that do not implement it are stored whole under the {@code State} key.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ScopeState {
  /**
   * Returns the properties this state contributes to the active scope.
   *
   * @return property map; {@code null} is treated as empty
   */
  Map<String, Object> toScopeProperties();
}
