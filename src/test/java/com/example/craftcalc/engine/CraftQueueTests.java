package com.example.craftcalc.engine;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

public class CraftQueueTests {

  /** Pops everything as {@code item@depth}. */
  private static List<String> drain(CraftQueue q) {
    List<String> out = new ArrayList<>();
    CraftQueue.Entry e;
    while ((e = q.poll()) != null) out.add(e.item + "@" + e.depth);
    return out;
  }

  @Test
  void shallowestFirstThenDiscoveryOrder() {
    CraftQueue q = new CraftQueue();
    q.raise("a", 1);
    q.raise("b", 0);
    q.raise("c", 1);
    assertEquals(List.of("b@0", "a@1", "c@1"), drain(q));
    assertNull(q.poll());
  }

  @Test
  void depthIsNeverLowered() {
    CraftQueue q = new CraftQueue();
    q.raise("a", 3);
    q.raise("a", 1);
    q.raise("a", 3);
    assertEquals(List.of("a@3"), drain(q));

    q.raise("a", 3);
    q.raise("a", 4);
    assertEquals(List.of("a@4"), drain(q));
  }

  @Test
  void raisedItemKeepsItsDiscoveryPosition() {
    CraftQueue q = new CraftQueue();
    q.raise("a", 1);
    q.raise("b", 2);
    q.raise("c", 2);
    q.raise("a", 2);
    assertEquals(List.of("a@2", "b@2", "c@2"), drain(q));
  }

  @Test
  void poppedItemIsQueuedAgainAsNew() {
    CraftQueue q = new CraftQueue();
    q.raise("a", 0);
    q.raise("b", 1);
    assertEquals("a", q.poll().item);
    q.raise("a", 1);
    assertEquals(List.of("b@1", "a@1"), drain(q));
  }

  @Test
  void childDepthBelowTheBoundLeavesTheQueueAlone() {
    CraftQueue q = new CraftQueue(3);
    q.raise("x", 3);
    q.raise("y", 3);
    q.raise("z", 2);
    assertEquals(2, q.childDepth(1));
    assertEquals(List.of("z@2", "x@3", "y@3"), drain(q));
  }

  @Test
  void childDepthCompactsAtTheBound() {
    CraftQueue q = new CraftQueue(3);
    q.raise("x", 3);
    q.raise("y", 3);
    q.raise("z", 2);
    assertEquals(3, q.childDepth(3));
    q.raise("w", 3);
    assertEquals(List.of("z@0", "x@1", "y@2", "w@3"), drain(q));
  }

  @Test
  void compactingAnEmptyQueueStartsAtZero() {
    CraftQueue q = new CraftQueue(0);
    assertEquals(0, q.childDepth(0));
    assertNull(q.poll());
  }
}
