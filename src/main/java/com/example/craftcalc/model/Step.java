package com.example.craftcalc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One plan entry: run {@code recipe} {@code repeats} times. */
public final class Step {
    private final Recipe recipe;
    private final long repeats;

    public Step(Recipe recipe, long repeats) {
        this.recipe = Objects.requireNonNull(recipe, "recipe");
        this.repeats = repeats;
    }

    public Recipe getRecipe() { return recipe; }
    public long getRepeats() { return repeats; }

    /** Total produced by this step. */
    public Stack getResult() { return recipe.getResult().times(repeats); }

    /** Total consumed by this step, in recipe order. */
    public List<Stack> getIngredients() {
        List<Stack> out = new ArrayList<>(recipe.getIngredients().size());
        for (Stack s : recipe.getIngredients()) out.add(s.times(repeats));
        return Collections.unmodifiableList(out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Step)) return false;
        Step other = (Step) o;
        return repeats == other.repeats && recipe.equals(other.recipe);
    }

    @Override public int hashCode() { return Objects.hash(recipe, repeats); }

    @Override public String toString() { return recipe + " x" + repeats; }
}
