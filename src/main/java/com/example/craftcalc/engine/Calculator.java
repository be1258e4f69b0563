package com.example.craftcalc.engine;

import com.example.craftcalc.model.Recipe;
import com.example.craftcalc.model.Stack;
import com.example.craftcalc.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Works out which recipes to run, how often, and in what order to reach a target stack from
 * the known recipes and the resources already at hand.
 *
 * <p>Every mutating call rebuilds the whole plan. The rebuild happens on copies of the state,
 * so a call that fails (overflow, recipe cycle) leaves the calculator as it was.
 * Not thread-safe.
 */
public class Calculator {
    private static final Logger LOG = LoggerFactory.getLogger(Calculator.class);

    /** Target of a calculator that has not been given one. It is never planned for. */
    public static final Stack NO_TARGET = new Stack("Air", 1);

    private final Map<String, Recipe> recipes = new LinkedHashMap<>();
    private final Map<String, Long> resources = new LinkedHashMap<>();
    private Stack target = NO_TARGET;
    private List<Step> steps = List.of();

    public Calculator() {}

    /** Starts with the given recipes; a later recipe for the same item replaces an earlier one. */
    public Calculator(Collection<Recipe> recipes) {
        for (Recipe r : recipes) this.recipes.put(r.getResult().getItem(), r);
    }

    public Collection<Recipe> getRecipes() { return Collections.unmodifiableCollection(recipes.values()); }

    public Optional<Recipe> getRecipe(String item) { return Optional.ofNullable(recipes.get(item)); }

    public Stack getTarget() { return target; }

    public boolean hasTarget() { return target != NO_TARGET; }

    /** Supplied resources in the order they were first added. */
    public List<Stack> getResources() {
        List<Stack> out = new ArrayList<>(resources.size());
        for (var e : resources.entrySet()) out.add(new Stack(e.getKey(), e.getValue()));
        return out;
    }

    /** The plan from the last recomputation. */
    public List<Step> getSteps() { return steps; }

    /** Adds {@code resource} to what is already available; counts for the same item add up. */
    public void addResource(Stack resource) {
        Objects.requireNonNull(resource, "resource");
        Map<String, Long> pool = new LinkedHashMap<>(resources);
        pool.merge(resource.getItem(), resource.getCount(), Math::addExact);
        List<Step> planned = calculateSteps(recipes, pool, target);
        resources.clear();
        resources.putAll(pool);
        steps = planned;
    }

    /** Uses {@code recipe} to produce its result item from now on. */
    public void setRecipe(Recipe recipe) {
        addRecipes(List.of(Objects.requireNonNull(recipe, "recipe")));
    }

    /** Registers every recipe in order; if several produce the same item, the last one wins. */
    public void addRecipes(Collection<Recipe> added) {
        Map<String, Recipe> catalog = new LinkedHashMap<>(recipes);
        for (Recipe r : added) catalog.put(r.getResult().getItem(), r);
        List<Step> planned = calculateSteps(catalog, resources, target);
        recipes.clear();
        recipes.putAll(catalog);
        steps = planned;
    }

    public void setTarget(Stack target) {
        Objects.requireNonNull(target, "target");
        steps = calculateSteps(recipes, resources, target);
        this.target = target;
    }

    private static List<Step> calculateSteps(Map<String, Recipe> recipes, Map<String, Long> pool, Stack target) {
        if (target == NO_TARGET) return List.of();
        checkForCycles(recipes, target.getItem());
        List<Step> discovered = propagateDemand(recipes, pool, target);
        List<Step> plan = orderSteps(discovered);
        LOG.debug("Planned {} steps ({} before merging) for {}", plan.size(), discovered.size(), target);
        return Collections.unmodifiableList(plan);
    }

    // ---- cycle detection ----

    /** An item on the current search path and the ingredients still to look at. */
    private static final class Frame {
        final String item;
        final Iterator<Stack> ingredients;
        Frame(String item, Recipe recipe) { this.item = item; this.ingredients = recipe.getIngredients().iterator(); }
    }

    /** Depth-first search from {@code start} with an explicit stack, so chain length is not bounded by the thread stack. */
    private static void checkForCycles(Map<String, Recipe> recipes, String start) {
        Deque<Frame> path = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        Set<String> done = new HashSet<>();
        enter(start, recipes, path, onPath, done);
        while (!path.isEmpty()) {
            Frame top = path.peek();
            if (top.ingredients.hasNext()) {
                enter(top.ingredients.next().getItem(), recipes, path, onPath, done);
            } else {
                path.pop();
                onPath.remove(top.item);
                done.add(top.item);
            }
        }
    }

    private static void enter(String item, Map<String, Recipe> recipes, Deque<Frame> path, Set<String> onPath, Set<String> done) {
        if (done.contains(item)) return;
        Recipe recipe = recipes.get(item);
        if (recipe == null) {
            done.add(item);
            return;
        }
        if (onPath.contains(item)) {
            List<String> cycle = new ArrayList<>();
            Iterator<Frame> fromBottom = path.descendingIterator();
            boolean inCycle = false;
            while (fromBottom.hasNext()) {
                String onStack = fromBottom.next().item;
                if (onStack.equals(item)) inCycle = true;
                if (inCycle) cycle.add(onStack);
            }
            cycle.add(item);
            throw new RecipeCycleException(cycle);
        }
        onPath.add(item);
        path.push(new Frame(item, recipe));
    }

    // ---- phase A: demand propagation ----

    /**
     * Walks the recipe graph outwards from the target, shallowest depth first, and records what
     * has to be produced. The result is in discovery order, not in an order that can be executed.
     */
    private static List<Step> propagateDemand(Map<String, Recipe> recipes, Map<String, Long> pool, Stack target) {
        Map<String, Long> materials = new HashMap<>(pool);
        Map<String, Long> surplus = new HashMap<>();
        Map<String, Long> toCraft = new HashMap<>();
        List<Step> discovered = new ArrayList<>();

        CraftQueue queue = new CraftQueue();
        toCraft.put(target.getItem(), target.getCount());
        queue.raise(target.getItem(), 0);

        CraftQueue.Entry next;
        while ((next = queue.poll()) != null) {
            Long outstanding = toCraft.remove(next.item);
            if (outstanding == null) continue;
            long count = outstanding;

            count -= draw(surplus, next.item, count);
            long stored = draw(materials, next.item, count);
            if (stored > 0) {
                discovered.add(new Step(Recipe.inStorage(next.item), stored));
                count -= stored;
            }
            if (count == 0) continue;

            Recipe recipe = recipes.get(next.item);
            if (recipe == null) {
                discovered.add(new Step(Recipe.rawMaterial(next.item), count));
                continue;
            }
            long perExecution = recipe.getResult().getCount();
            long repeats = count / perExecution + (count % perExecution == 0 ? 0 : 1);
            discovered.add(new Step(recipe, repeats));
            long produced = Math.multiplyExact(perExecution, repeats);
            if (produced > count) {
                // any earlier surplus of this item was drained above
                surplus.put(next.item, produced - count);
            }
            int childDepth = queue.childDepth(next.depth);
            for (Stack ingredient : recipe.getIngredients()) {
                toCraft.merge(ingredient.getItem(), Math.multiplyExact(ingredient.getCount(), repeats), Math::addExact);
                queue.raise(ingredient.getItem(), childDepth);
            }
        }
        if (!toCraft.isEmpty()) {
            throw new IllegalStateException("Demand left unresolved after propagation: " + toCraft);
        }
        return discovered;
    }

    /** Takes up to {@code wanted} of {@code item} out of {@code pool}; returns the amount taken. */
    private static long draw(Map<String, Long> pool, String item, long wanted) {
        Long available = pool.get(item);
        if (available == null || available == 0 || wanted == 0) return 0;
        long taken = Math.min(available, wanted);
        pool.put(item, available - taken);
        return taken;
    }

    // ---- phase B: ordering ----

    /**
     * Reorders the discovered steps so that no step comes before the steps that make its
     * ingredients, merging steps that produce the same item.
     */
    private static List<Step> orderSteps(List<Step> discovered) {
        Map<String, Step> rawMaterials = new LinkedHashMap<>();
        Map<String, Step> fromStorage = new LinkedHashMap<>();
        List<Step> pending = new ArrayList<>();
        for (Step step : discovered) {
            Recipe r = step.getRecipe();
            if (r.isRawMaterial()) mergeInto(rawMaterials, step);
            else if (r.isInStorage()) mergeInto(fromStorage, step);
            else pending.add(step);
        }

        List<Step> plan = new ArrayList<>(rawMaterials.values());
        Set<String> available = new HashSet<>(rawMaterials.keySet());

        while (!pending.isEmpty()) {
            Map<String, Step> stage = new LinkedHashMap<>();
            List<Step> deferred = new ArrayList<>();
            for (Step step : pending) {
                if (!isReady(step, available, fromStorage)) {
                    deferred.add(step);
                    continue;
                }
                for (Stack ingredient : step.getRecipe().getIngredients()) {
                    Step stored = fromStorage.remove(ingredient.getItem());
                    if (stored != null) {
                        plan.add(stored);
                        available.add(ingredient.getItem());
                    }
                }
                mergeInto(stage, step);
            }
            if (stage.isEmpty()) {
                throw new IllegalStateException("No step can run next, all wait on missing ingredients: " + deferred);
            }
            plan.addAll(stage.values());
            available.addAll(stage.keySet());
            pending = deferred;
        }
        // storage draws nothing consumed, e.g. the target itself was in storage
        plan.addAll(fromStorage.values());
        return plan;
    }

    private static boolean isReady(Step step, Set<String> available, Map<String, Step> fromStorage) {
        for (Stack ingredient : step.getRecipe().getIngredients()) {
            if (ingredient.getCount() == 0 || available.contains(ingredient.getItem())) continue;
            Step stored = fromStorage.get(ingredient.getItem());
            if (stored == null) return false;
            long stocked = stored.getResult().getCount();
            if (stocked < Math.multiplyExact(ingredient.getCount(), step.getRepeats())) return false;
        }
        return true;
    }

    private static void mergeInto(Map<String, Step> merged, Step step) {
        String item = step.getRecipe().getResult().getItem();
        Step existing = merged.get(item);
        merged.put(item, existing == null ? step
                : new Step(existing.getRecipe(), Math.addExact(existing.getRepeats(), step.getRepeats())));
    }
}
