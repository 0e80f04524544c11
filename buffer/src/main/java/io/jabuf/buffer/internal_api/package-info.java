/**
 * Storage-level helpers used by {@link io.jabuf.buffer.ArrayBuffer}. Not part of the public API.
 */
@Internal
package io.jabuf.buffer.internal_api;

import io.jabuf.buffer.api.Internal;
