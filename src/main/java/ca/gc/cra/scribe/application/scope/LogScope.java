package ca.gc.cra.scribe.application.scope;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One frame of the per-thread logging scope stack.
 * <p><strong>Why:</strong> Request-level context (ids, user, tenant) should decorate every entry logged inside a
 * region of code without being passed to each log call.</p>
 * <p><strong>Role:</strong> Application service backing {@code StructuredLogger.beginScope}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Push a frame on {@link #begin(Object)} and restore the parent frame on {@link #close()}.</li>
 *   <li>Merge the properties of all open frames with inner frames overriding outer ones.</li>
 *   <li>Carry a captured chain onto another thread via {@link #wrap(Runnable)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Frames are immutable apart from their closed flag; the stack tip is held in a
 * {@link ThreadLocal}, so concurrent threads never see each other's scopes.</p>
 * <p><strong>Performance:</strong> Merging is O(total properties across open frames).</p>
 * <p><strong>Observability:</strong> Merged properties surface as {@code scope.*} JSON keys and the
 * {@code ScopeProperties} SQLite column.</p>
 *
 * @implNote Closing is idempotent. Closing a frame that is not the tip marks it closed; it is skipped when merging
 * and popped once the frames above it close.
 * @since 0.1.0
 */
public final class LogScope implements AutoCloseable {
  static final String STRING_STATE_KEY = "Scope";
  static final String OBJECT_STATE_KEY = "State";

  private static final ThreadLocal<LogScope> CURRENT = new ThreadLocal<>();

  private final LogScope parent;
  private final Map<String, Object> properties;
  private volatile boolean closed;

  private LogScope(LogScope parent, Map<String, Object> properties) {
    this.parent = parent;
    this.properties = properties;
  }

  /**
   * Opens a scope on the calling thread.
   *
   * <p>Accepted states: a {@link Map} with string keys, a {@link ScopeState}, an {@link Iterable} of
   * {@link Map.Entry}, a {@link String} (stored as {@code Scope}), or any other object (stored whole as
   * {@code State}). A {@code null} state opens an empty scope.</p>
   *
   * @param state scope state
   * @return handle that closes the scope
   */
  public static LogScope begin(Object state) {
    LogScope scope = new LogScope(CURRENT.get(), toProperties(state));
    CURRENT.set(scope);
    return scope;
  }

  /**
   * Opens a scope holding a single named property.
   *
   * @param name property name; must not be {@code null}
   * @param value property value; may be {@code null}
   * @return handle that closes the scope
   */
  public static LogScope begin(String name, Object value) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> props = new LinkedHashMap<>(2);
    props.put(name, value);
    return begin(props);
  }

  /**
   * Returns the merged properties of the calling thread's open scopes.
   *
   * @return merged properties, inner frames winning; empty when no scope is open
   */
  public static Map<String, Object> currentProperties() {
    LogScope tip = CURRENT.get();
    if (tip == null) {
      return Map.of();
    }
    Deque<LogScope> chain = new ArrayDeque<>();
    for (LogScope scope = tip; scope != null; scope = scope.parent) {
      if (!scope.closed) {
        chain.push(scope);
      }
    }
    Map<String, Object> merged = new LinkedHashMap<>();
    for (LogScope scope : chain) {
      merged.putAll(scope.properties);
    }
    return merged;
  }

  /**
   * Indicates whether the calling thread has an open scope.
   *
   * @return {@code true} if at least one scope is open
   */
  public static boolean isActive() {
    return CURRENT.get() != null;
  }

  /**
   * Captures the caller's scope chain and returns a task that runs with it installed.
   *
   * @param task task to decorate; must not be {@code null}
   * @return decorated task restoring the executing thread's own chain afterwards
   */
  public static Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    LogScope captured = CURRENT.get();
    return () -> {
      LogScope previous = CURRENT.get();
      install(captured);
      try {
        task.run();
      } finally {
        install(previous);
      }
    };
  }

  /**
   * Returns this frame's own properties.
   *
   * @return unmodifiable properties contributed by this frame
   */
  public Map<String, Object> properties() {
    return properties;
  }

  /** Closes the scope and restores its parent as the current frame. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (CURRENT.get() != this) {
      return;
    }
    LogScope next = parent;
    while (next != null && next.closed) {
      next = next.parent;
    }
    install(next);
  }

  private static void install(LogScope scope) {
    if (scope == null) {
      CURRENT.remove();
    } else {
      CURRENT.set(scope);
    }
  }

  private static Map<String, Object> toProperties(Object state) {
    if (state == null) {
      return Map.of();
    }
    Map<String, Object> props = new LinkedHashMap<>();
    if (state instanceof Map<?, ?> map) {
      map.forEach((k, v) -> props.put(String.valueOf(k), v));
    } else if (state instanceof ScopeState scopeState) {
      Map<String, Object> converted = scopeState.toScopeProperties();
      if (converted != null) {
        props.putAll(converted);
      }
    } else if (state instanceof CharSequence text) {
      props.put(STRING_STATE_KEY, text.toString());
    } else if (state instanceof Iterable<?> iterable && isEntryIterable(iterable)) {
      for (Object item : iterable) {
        Map.Entry<?, ?> entry = (Map.Entry<?, ?>) item;
        props.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    } else {
      props.put(OBJECT_STATE_KEY, state);
    }
    return props.isEmpty() ? Map.of() : Collections.unmodifiableMap(props);
  }

  private static boolean isEntryIterable(Iterable<?> iterable) {
    for (Object item : iterable) {
      if (!(item instanceof Map.Entry<?, ?>)) {
        return false;
      }
    }
    return true;
  }
}
