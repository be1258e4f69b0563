package com.example.craftcalc.engine;

import java.util.List;

/** Thrown when the target depends on an item whose recipe needs that item again. */
public class RecipeCycleException extends IllegalArgumentException {
    private final List<String> cycle;

    public RecipeCycleException(List<String> cycle) {
        super("Recipe cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Items along the cycle, first and last being the same item. */
    public List<String> getCycle() { return cycle; }
}
