package com.example.craftcalc.services;

import com.example.craftcalc.model.Recipe;
import com.example.craftcalc.model.Stack;
import com.example.craftcalc.model.Step;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.List;

/** Writes recipes, plans and resources in the format {@link RecipeParser} reads. */
public class RecipeWriter {
    private static final String INDENT = "    ";

    public String format(Stack stack) {
        return stack.getItem() + " (" + stack.getCount() + ")";
    }

    /** One recipe block with every count multiplied by {@code repeats}. */
    public String format(Recipe recipe, long repeats) {
        StringBuilder sb = new StringBuilder();
        sb.append(format(recipe.getResult().times(repeats)))
          .append(" (").append(recipe.getMethod()).append("):\n");
        for (Stack ingredient : recipe.getIngredients()) {
            sb.append(INDENT).append(format(ingredient.times(repeats))).append('\n');
        }
        return sb.toString();
    }

    public String format(Step step) {
        return format(step.getRecipe(), step.getRepeats());
    }

    public void writeRecipes(Collection<Recipe> recipes, Writer out) throws IOException {
        boolean first = true;
        for (Recipe r : recipes) {
            if (!first) out.write('\n');
            first = false;
            out.write(format(r, 1));
        }
        out.flush();
    }

    public void writeSteps(List<Step> steps, Writer out) throws IOException {
        boolean first = true;
        for (Step s : steps) {
            if (!first) out.write('\n');
            first = false;
            out.write(format(s));
        }
        out.flush();
    }

    public void writeResources(List<Stack> resources, Writer out) throws IOException {
        for (Stack s : resources) out.write(format(s) + "\n");
        out.flush();
    }
}
