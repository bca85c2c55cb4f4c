package com.radar.anomaly.stream;

import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Last N points per key, read by the batch detectors. Each point carries an arrival sequence so
 * readers can tell what came in since their last pass, whatever its timestamp.
 */
@Component
public class RecentPointsBuffer {

  private final ConcurrentHashMap<MetricKey, Deque<Arrival>> windows = new ConcurrentHashMap<>();
  private final AtomicLong arrivals = new AtomicLong();
  private final int capacity;

  private record Arrival(long seq, MetricPoint point) {}

  /** Points ordered by timestamp, and the highest arrival sequence among them. */
  public record Window(List<MetricPoint> points, Set<MetricPoint> arrivedAfterMark, long lastArrival) {
    public boolean isEmpty() {
      return points.isEmpty();
    }
  }

  public RecentPointsBuffer(@Value("${radar.stream.window-capacity:512}") int capacity) {
    this.capacity = capacity;
  }

  public void append(MetricKey key, MetricPoint point) {
    Deque<Arrival> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>(capacity));
    synchronized (window) {
      if (window.size() >= capacity) window.pollFirst();
      window.addLast(new Arrival(arrivals.incrementAndGet(), point));
    }
  }

  /** Copy of the window for {@code key}, oldest first. */
  public List<MetricPoint> snapshot(MetricKey key) {
    return window(key, 0).points();
  }

  /** Copy of the window for {@code key}, with the points that arrived after {@code mark}. */
  public Window window(MetricKey key, long mark) {
    Deque<Arrival> window = windows.get(key);
    if (window == null) return new Window(List.of(), Set.of(), mark);
    List<Arrival> copy;
    synchronized (window) {
      copy = new ArrayList<>(window);
    }
    List<MetricPoint> points = new ArrayList<>(copy.size());
    Set<MetricPoint> fresh = new HashSet<>();
    long last = mark;
    for (Arrival a : copy) {
      points.add(a.point());
      if (a.seq() > mark) fresh.add(a.point());
      last = Math.max(last, a.seq());
    }
    points.sort(Comparator.comparing(MetricPoint::timestamp));
    return new Window(points, fresh, last);
  }

  public Set<MetricKey> keys() {
    return Set.copyOf(windows.keySet());
  }
}
