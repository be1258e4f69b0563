package com.example.craftcalc;

import com.example.craftcalc.engine.Calculator;
import com.example.craftcalc.model.*;
import com.example.craftcalc.model.Stack;
import com.example.craftcalc.storage.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

public class ShellTests {
  @TempDir Path tmp;

  private final StringWriter out = new StringWriter();
  private final StringWriter err = new StringWriter();

  private Shell shell(String input) {
    return new Shell(new Calculator(), new Settings(), new SettingsStorage(tmp.resolve("cfg")),
        new BufferedReader(new StringReader(input)), new PrintWriter(out), new PrintWriter(err));
  }

  private String sampleRecipes() throws Exception {
    return Path.of(getClass().getResource("/sample-data/wooden-tools.recipes").toURI()).toString();
  }

  @Test
  void scriptedSessionPrintsPlan() throws Exception {
    Shell sh = shell("load " + sampleRecipes() + "\n"
        + "target Wooden Shovel (1)\n"
        + "res Stick (1)\n"
        + "print\n");
    sh.run();
    assertEquals("", err.toString());
    assertEquals(6, sh.getCalculator().getRecipes().size());
    assertEquals(List.of(new Stack("Stick", 1)), sh.getCalculator().getResources());
    String printed = out.toString();
    assertTrue(printed.contains("Oak Log (1) (Raw Material):\n"));
    assertTrue(printed.contains("Stick (1) (In Storage):\n\nWooden Shovel (1) (Crafting Table):\n"));
  }

  @Test
  void recipeCommandPromptsForParts() throws Exception {
    Shell sh = shell("recipe\nCharcoal (1)\nFurnace\nOak Log (1)\n\ntarget Charcoal (3)\n");
    sh.run();
    Recipe charcoal = sh.getCalculator().getRecipe("Charcoal").orElseThrow();
    assertEquals("Furnace", charcoal.getMethod());
    assertEquals(List.of(new Stack("Oak Log", 1)), charcoal.getIngredients());
    assertEquals(new Step(charcoal, 3), sh.getCalculator().getSteps().get(1));
    assertTrue(out.toString().contains("Enter crafting method: "));
  }

  @Test
  void targetWithoutArgumentShowsCurrentTarget() {
    Shell sh = shell("");
    sh.execute("target");
    sh.execute("target Stick (2)");
    sh.execute("t");
    assertTrue(out.toString().contains("No target set"));
    assertTrue(out.toString().contains("Current target is Stick (2)"));
  }

  @Test
  void errorsAreReportedAndTheShellGoesOn() throws Exception {
    Shell sh = shell("resource Stick\n"
        + "load " + tmp.resolve("missing.recipes") + "\n"
        + "print nonsense\n"
        + "target Stick (1)\n");
    sh.run();
    String e = err.toString();
    assertTrue(e.contains("Couldn't parse input"), e);
    assertTrue(e.contains("I/O error"), e);
    assertTrue(out.toString().contains("Unknown `what`"));
    assertEquals(new Stack("Stick", 1), sh.getCalculator().getTarget());
  }

  @Test
  void cycleIsRejected() throws Exception {
    Path file = tmp.resolve("loop.recipes");
    Files.writeString(file, "A (1): B (1)\n\nB (1): A (1)\n");
    Shell sh = shell("");
    assertTrue(sh.execute("load " + file));
    assertFalse(sh.execute("target A (1)"));
    assertTrue(err.toString().contains("Rejected: Recipe cycle: A -> B -> A"));
    assertFalse(sh.getCalculator().hasTarget());
  }

  @Test
  void unknownCommandPrintsHelp() {
    Shell sh = shell("");
    sh.execute("frobnicate");
    assertTrue(out.toString().contains("write <file> [what]"));
    assertTrue(out.toString().contains("load <file>"));

    sh.execute("help print");
    assertTrue(out.toString().contains("If `what` is omitted, it is assumed to be `steps`."));
  }

  @Test
  void writeDefaultsToRecipes() throws Exception {
    Shell sh = shell("");
    sh.execute("load " + sampleRecipes());
    sh.execute("target Torch (4)");
    Path recipes = tmp.resolve("all recipes.txt");
    Path steps = tmp.resolve("steps.txt");
    assertTrue(sh.execute("write " + recipes));
    assertTrue(sh.execute("write " + steps + " steps"));
    assertTrue(Files.readString(recipes).startsWith("Oak Wood Planks (4) (Crafting Table):\n    Oak Log (1)\n"));
    assertTrue(Files.readString(steps).endsWith("Torch (4) (Crafting Table):\n    Charcoal (1)\n    Stick (1)\n"));
  }

  @Test
  void saveAndOpenRememberTheSession() throws Exception {
    Path session = tmp.resolve("session.json");
    Shell sh = shell("");
    sh.execute("load " + sampleRecipes());
    sh.execute("resource Stick (1)");
    sh.execute("target Wooden Shovel (1)");
    assertTrue(sh.execute("save " + session));
    assertEquals(session.toAbsolutePath().toString(), sh.getSettings().lastSessionPath);
    assertEquals(session.toAbsolutePath().toString(),
        new SettingsStorage(tmp.resolve("cfg")).load().lastSessionPath);

    List<Step> saved = sh.getCalculator().getSteps();
    sh.execute("target Stick (1)");
    assertTrue(sh.execute("open"));
    assertEquals(saved, sh.getCalculator().getSteps());
  }

  @Test
  void quitStopsTheLoop() throws Exception {
    Shell sh = shell("quit\ntarget Stick (1)\n");
    sh.run();
    assertFalse(sh.getCalculator().hasTarget());
  }

  @Test
  void parsesCommandLineOptions() {
    App.Options o = App.Options.parse(new String[] {"-r", "a.recipes", "--recipes", "b.recipes", "-s", "s.json"});
    assertEquals(List.of("a.recipes", "b.recipes"), o.recipeFiles);
    assertEquals("s.json", o.session);
    assertFalse(o.help);
    assertTrue(App.Options.parse(new String[] {"--help"}).help);
    assertThrows(IllegalArgumentException.class, () -> App.Options.parse(new String[] {"-r"}));
    assertThrows(IllegalArgumentException.class, () -> App.Options.parse(new String[] {"--gui"}));
  }
}
