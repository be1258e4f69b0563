package com.example.craftcalc;

import com.example.craftcalc.engine.Calculator;
import com.example.craftcalc.model.*;
import com.example.craftcalc.model.Stack;
import com.example.craftcalc.services.*;
import com.example.craftcalc.storage.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/** Interactive command loop around a {@link Calculator}. */
public class Shell {
    private static final Logger LOG = LoggerFactory.getLogger(Shell.class);
    private static final Set<String> WHATS = Set.of("steps", "resources", "recipes");

    @FunctionalInterface
    interface Action {
        void apply(String arguments) throws IOException, RecipeFormatException;
    }

    static final class Command {
        final String name;
        final String example;
        final String shortHelp;
        final String longHelp;
        final Action action;
        Command(String name, String example, String shortHelp, String longHelp, Action action) {
            this.name = name; this.example = example; this.shortHelp = shortHelp;
            this.longHelp = longHelp == null ? shortHelp : longHelp; this.action = action;
        }
    }

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final Settings settings;
    private final SettingsStorage settingsStorage; // nullable: settings are then not persisted
    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;
    private final RecipeWriter writer = new RecipeWriter();
    private final JsonStorage storage = new JsonStorage();
    private Calculator calculator;
    private boolean running;

    public Shell(Calculator calculator, Settings settings, SettingsStorage settingsStorage,
                 BufferedReader in, PrintWriter out, PrintWriter err) {
        this.calculator = calculator;
        this.settings = settings == null ? new Settings() : settings;
        this.settingsStorage = settingsStorage;
        this.in = in; this.out = out; this.err = err;

        register("help", "help [cmd]", "Print this help message or print detailed help about `cmd`.",
                "Print information about the available commands. Use `help cmd` to print help about the command `cmd`.",
                this::help);
        register("load", "load <file>", "Read recipes from `file`.",
                "Read recipes from `file` and add them to the calculator. Files ending in .json hold a JSON recipe list.",
                this::load);
        register("print", "print [what]", "Print the current state of the calculator.",
                "Print the current state of the calculator.\n`what` can be `steps`, `resources`, or `recipes`. If `what` is omitted, it is assumed to be `steps`.",
                this::print);
        register("recipe", "recipe", "Add a new recipe to the calculator.",
                "Prompts for the result, the method and the ingredients (a blank line ends the list) and adds that recipe to the calculator.",
                a -> addRecipe());
        register("resource", "resource [stack]", "Adds `stack` as a resource that is already available for crafting.",
                "Adds `stack` as a resource that is already available and therefore does not need to be crafted.",
                this::resource);
        register("target", "target [stack]", "Sets the calculator to target `stack` or prints the current target.",
                "If `stack` is given, the calculator's target is set to `stack`. Otherwise, prints the calculator's current target.",
                this::target);
        register("write", "write <file> [what]", "Similar to `print what` but writes to `file` and defaults to `recipes`.",
                "Write the current state of the calculator to `file`.\n`what` can be `steps`, `resources`, or `recipes`. If `what` is omitted, it is assumed to be `recipes`.",
                this::write);
        register("save", "save [file]", "Save the whole calculator as JSON.",
                "Save recipes, resources and target to `file` as JSON. Without `file`, the last session file is used.",
                this::save);
        register("open", "open [file]", "Replace the calculator with one saved by `save`.",
                "Load recipes, resources and target from the JSON `file`. Without `file`, the last session file is used.",
                this::open);
        register("quit", "quit", "Leave the calculator.", null, a -> running = false);
    }

    private void register(String name, String example, String shortHelp, String longHelp, Action action) {
        commands.put(name, new Command(name, example, shortHelp, longHelp, action));
    }

    public Calculator getCalculator() { return calculator; }

    public Settings getSettings() { return settings; }

    /** Reads and runs commands until `quit` or the end of input. */
    public void run() throws IOException {
        running = true;
        while (running) {
            out.print("$ ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            execute(line);
        }
        out.flush();
    }

    /**
     * Runs one command line. The first word selects the first command whose name starts with it.
     * Failures are reported on the error stream.
     * @return true if the command completed
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return true;
        String word = trimmed.split("\\s+", 2)[0];
        String arguments = trimmed.substring(word.length()).trim();
        Command command = null;
        for (Command c : commands.values()) {
            if (c.name.startsWith(word)) { command = c; break; }
        }
        try {
            if (command == null) help("");
            else command.action.apply(arguments);
            return true;
        } catch (RecipeFormatException ex) {
            err.println("Couldn't parse input: " + ex.getMessage());
        } catch (IOException ex) {
            LOG.debug("Command '{}' failed", trimmed, ex);
            err.println("I/O error: " + ex.getMessage());
        } catch (IllegalArgumentException | ArithmeticException ex) {
            err.println("Rejected: " + ex.getMessage());
        } catch (IllegalStateException ex) {
            LOG.error("Internal error while running '{}'", trimmed, ex);
            err.println("Internal error: " + ex.getMessage());
        } finally {
            out.flush();
            err.flush();
        }
        return false;
    }

    private void help(String arguments) {
        if (!arguments.isEmpty()) {
            Command c = commands.get(arguments);
            if (c != null) {
                out.println(c.longHelp);
                return;
            }
        }
        int width = 0;
        for (Command c : commands.values()) width = Math.max(width, c.example.length());
        for (Command c : commands.values()) {
            out.println(String.format("%-" + width + "s   %s", c.example, c.shortHelp));
        }
    }

    private RecipeParser parser() { return new RecipeParser(settings.defaultMethod); }

    private void load(String file) throws IOException, RecipeFormatException {
        if (file.isEmpty()) throw new IllegalArgumentException("`load` needs a file");
        Path path = Path.of(file);
        List<Recipe> recipes;
        if (file.toLowerCase(Locale.ROOT).endsWith(".json")) {
            try (InputStream is = Files.newInputStream(path)) {
                recipes = storage.loadRecipes(is);
            }
        } else {
            recipes = parser().parseRecipes(path);
        }
        calculator.addRecipes(recipes);
        LOG.info("Loaded {} recipes from {}", recipes.size(), path);
    }

    private void print(String what) throws IOException {
        String w = what.isEmpty() ? "steps" : what;
        if (!WHATS.contains(w)) {
            out.println("Unknown `what`: \"" + what + "\"");
            return;
        }
        writeState(w, out);
    }

    private void writeState(String what, Writer target) throws IOException {
        switch (what) {
            case "steps": writer.writeSteps(calculator.getSteps(), target); break;
            case "resources": writer.writeResources(calculator.getResources(), target); break;
            default: writer.writeRecipes(calculator.getRecipes(), target); break;
        }
    }

    private String prompt(String message) throws IOException {
        out.print(message + ": ");
        out.flush();
        String line = in.readLine();
        if (line == null) throw new EOFException("input ended during prompt");
        return line.trim();
    }

    private void addRecipe() throws IOException, RecipeFormatException {
        RecipeParser p = parser();
        Stack result = p.parseStack(prompt("Enter result (ex: Oak Planks (4))"));
        String method = prompt("Enter crafting method");
        if (method.isEmpty()) method = p.getDefaultMethod();
        List<Stack> ingredients = new ArrayList<>();
        while (true) {
            String s = prompt("Enter ingredient (leave blank to finish)");
            if (s.isEmpty()) break;
            ingredients.add(p.parseStack(s));
        }
        calculator.setRecipe(new Recipe(result, method, ingredients));
    }

    private void resource(String arguments) throws IOException, RecipeFormatException {
        String text = arguments.isEmpty() ? prompt("Enter resource") : arguments;
        calculator.addResource(parser().parseStack(text));
    }

    private void target(String arguments) throws RecipeFormatException {
        if (arguments.isEmpty()) {
            out.println(calculator.hasTarget() ? "Current target is " + writer.format(calculator.getTarget()) : "No target set");
            return;
        }
        calculator.setTarget(parser().parseStack(arguments));
    }

    private void write(String arguments) throws IOException {
        if (arguments.isEmpty()) throw new IllegalArgumentException("Can't write state with no `file` argument.");
        String file = arguments;
        String what = "recipes";
        int space = arguments.lastIndexOf(' ');
        if (space > 0 && WHATS.contains(arguments.substring(space + 1))) {
            what = arguments.substring(space + 1);
            file = arguments.substring(0, space).trim();
        }
        try (Writer w = Files.newBufferedWriter(Path.of(file), StandardCharsets.UTF_8)) {
            writeState(what, w);
        }
    }

    private File sessionFile(String arguments) {
        String path = arguments.isEmpty() ? settings.lastSessionPath : arguments;
        if (path == null || path.isBlank()) throw new IllegalArgumentException("No session file given and none used before");
        return new File(path);
    }

    private void save(String arguments) throws IOException {
        File f = sessionFile(arguments);
        storage.saveCalculator(calculator, f);
        rememberSession(f);
        out.println("Saved session to " + f);
    }

    private void open(String arguments) throws IOException {
        File f = sessionFile(arguments);
        calculator = storage.loadCalculator(f);
        rememberSession(f);
        out.println("Opened session " + f);
    }

    private void rememberSession(File f) throws IOException {
        settings.lastSessionPath = f.getAbsolutePath();
        if (settingsStorage != null) settingsStorage.save(settings);
    }
}
