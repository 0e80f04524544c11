package io.jabuf.buffer.api;

import static java.lang.annotation.ElementType.*;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks APIs that are implementation details of the buffer and should not be used by external
 * code.
 *
 * <p>Types and members carrying this annotation may change or disappear in any release. The
 * storage-level helpers in {@code io.jabuf.buffer.internal_api} are the main users: they are public
 * only so the buffer and its view can share them across packages.
 *
 * <pre>{@code
 * @Internal
 * public final class GrowthPolicy {
 *   // reallocates raw storage blocks
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({TYPE, METHOD, FIELD, PACKAGE})
public @interface Internal {
  /**
   * Optional note on what public API to use instead.
   *
   * @return description of the internal API and alternatives
   */
  String value() default "";
}
