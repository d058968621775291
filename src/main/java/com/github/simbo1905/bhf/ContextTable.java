package com.github.simbo1905.bhf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Dense table of context offsets. The position of an offset in the table is its context id.
public final class ContextTable {

  private final int[] offsets;

  ContextTable(int[] offsets) {
    this.offsets = Objects.requireNonNull(offsets, "offsets cannot be null").clone();
  }

  public int size() {
    return offsets.length;
  }

  public boolean contains(int contextId) {
    return contextId >= 0 && contextId < offsets.length;
  }

  /// Returns the file offset of the Text record for a context.
  /// @throws IndexOutOfBoundsException if the id is not in the table
  public int offset(int contextId) {
    Objects.checkIndex(contextId, offsets.length);
    return offsets[contextId];
  }

  /// Returns every context id that points at the given offset, in ascending order.
  public List<Integer> idsAt(int offset) {
    List<Integer> ids = new ArrayList<>();
    for (int i = 0; i < offsets.length; i++) {
      if (offsets[i] == offset) {
        ids.add(i);
      }
    }
    return ids;
  }

  public List<Integer> toList() {
    return Arrays.stream(offsets).boxed().toList();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return Arrays.equals(offsets, ((ContextTable) obj).offsets);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(offsets);
  }

  @Override
  public String toString() {
    return "ContextTable" + Arrays.toString(offsets);
  }
}
