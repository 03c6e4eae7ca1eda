package org.waabox.presetcat.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Unmodifiable copies that keep insertion order and tolerate nulls.
 *
 * <p>Documents come from hand edited files, so a null list element or a
 * null map value must not make the whole document unreadable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Copies {

  private Copies() {
  }

  static <T> List<T> list(final List<T> source) {
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(source));
  }

  static <K, V> Map<K, V> map(final Map<K, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
