package io.streambatch.aggregate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered tuple of normalized grouping values with structural equality. Null elements are allowed
 * and compare equal to each other, so rows with a null group value form their own group.
 */
public final class GroupKey {
  private final Object[] values;
  private final int hash;

  public GroupKey(Object... values) {
    this.values = values.clone();
    this.hash = Arrays.hashCode(this.values);
  }

  public int size() {
    return values.length;
  }

  public Object get(int index) {
    return values[index];
  }

  public List<Object> values() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey other = (GroupKey) o;
    return hash == other.hash && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
