package org.minnen.forecastblend.align;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/** Priority queue that ignores values it already holds and drains in ascending order. */
public class UniqueMinQueue<T extends Comparable<T>>
{
  private final PriorityQueue<T> heap    = new PriorityQueue<>();
  private final Set<T>           present = new HashSet<>();

  /** @return true if the value was added, false if it was already queued */
  public boolean add(T value)
  {
    if (!present.add(value)) return false;
    heap.add(value);
    return true;
  }

  public int size()
  {
    return heap.size();
  }

  public boolean isEmpty()
  {
    return heap.isEmpty();
  }

  /** Remove every value, smallest first. */
  public List<T> drain()
  {
    List<T> ret = new ArrayList<>(heap.size());
    while (!heap.isEmpty()) {
      ret.add(heap.poll());
    }
    present.clear();
    return ret;
  }
}
