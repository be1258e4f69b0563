package com.example.craftcalc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A known way to turn a list of ingredient stacks into one result stack.
 * Executing the recipe once consumes every ingredient and yields {@code result}.
 */
public final class Recipe {
    public static final String RAW_MATERIAL = "Raw Material";
    public static final String IN_STORAGE = "In Storage";

    private final Stack result;
    private final String method;
    private final List<Stack> ingredients;

    @JsonCreator
    public Recipe(@JsonProperty("result") Stack result,
                  @JsonProperty("method") String method,
                  @JsonProperty("ingredients") List<Stack> ingredients) {
        if (result == null) throw new IllegalArgumentException("Recipe result must not be null");
        if (result.getCount() == 0) throw new IllegalArgumentException("Recipe for " + result.getItem() + " yields nothing");
        if (method == null) throw new IllegalArgumentException("Recipe method must not be null");
        this.result = result;
        this.method = method;
        this.ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
    }

    /** Pseudo-recipe for an item nothing in the catalog produces. */
    public static Recipe rawMaterial(String item) {
        return new Recipe(new Stack(item, 1), RAW_MATERIAL, List.of());
    }

    /** Pseudo-recipe for an item taken from the supplied resources. */
    public static Recipe inStorage(String item) {
        return new Recipe(new Stack(item, 1), IN_STORAGE, List.of());
    }

    public Stack getResult() { return result; }
    public String getMethod() { return method; }
    public List<Stack> getIngredients() { return ingredients; }

    @JsonIgnore public boolean isRawMaterial() { return RAW_MATERIAL.equals(method) && ingredients.isEmpty(); }
    @JsonIgnore public boolean isInStorage() { return IN_STORAGE.equals(method) && ingredients.isEmpty(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recipe)) return false;
        Recipe other = (Recipe) o;
        return result.equals(other.result) && method.equals(other.method) && ingredients.equals(other.ingredients);
    }

    @Override public int hashCode() { return Objects.hash(result, method, ingredients); }

    @Override public String toString() { return result + " (" + method + "): " + ingredients; }
}
