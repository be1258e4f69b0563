package com.example.craftcalc.services;

import com.example.craftcalc.model.Recipe;
import com.example.craftcalc.model.Stack;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the recipe file format:
 * <pre>
 * Oak Wood Planks (4): Oak Log (1)
 *
 * Charcoal (1) (Furnace): Oak Log (1)
 *
 * Wooden Shovel (1):
 *     Oak Wood Planks (1)
 *     Stick (2)
 * </pre>
 * Recipes without a method in parentheses get the parser's default method. Counts may be
 * grouped with underscores ({@code 1_000}). Every line, the last one included, ends with a newline.
 */
public class RecipeParser {
    public static final String DEFAULT_METHOD = "Crafting Table";

    private final String defaultMethod;

    public RecipeParser() { this(DEFAULT_METHOD); }

    public RecipeParser(String defaultMethod) {
        this.defaultMethod = (defaultMethod == null || defaultMethod.isBlank()) ? DEFAULT_METHOD : defaultMethod;
    }

    public String getDefaultMethod() { return defaultMethod; }

    public List<Recipe> parseRecipes(Path file) throws IOException, RecipeFormatException {
        return parseRecipes(Files.readString(file, StandardCharsets.UTF_8));
    }

    public List<Recipe> parseRecipes(InputStream in) throws IOException, RecipeFormatException {
        return parseRecipes(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    public List<Recipe> parseRecipes(String text) throws RecipeFormatException {
        List<Recipe> out = new ArrayList<>();
        if (text.isEmpty()) return out;

        String[] lines = text.split("\n", -1);
        boolean terminated = text.endsWith("\n");
        int count = terminated ? lines.length - 1 : lines.length;
        for (int i = 0; i < count; i++) {
            if (lines[i].endsWith("\r")) lines[i] = lines[i].substring(0, lines[i].length() - 1);
        }
        if (!terminated && !lines[count - 1].isBlank()) {
            throw new RecipeFormatException("unterminated block, the last line has no newline", count);
        }

        int i = 0;
        while (i < count) {
            String line = lines[i];
            if (line.isBlank()) { i++; continue; }
            int headerLine = i + 1;
            if (Character.isWhitespace(line.charAt(0))) {
                throw new RecipeFormatException("indented line outside of a recipe", headerLine);
            }

            Cursor c = new Cursor(line, headerLine);
            Stack result = c.readStack();
            String method = c.readMethod();
            c.expect(':');
            String rest = c.remaining();
            i++;

            List<Stack> ingredients = new ArrayList<>();
            if (!rest.isBlank()) {
                ingredients.add(wholeStack(rest, headerLine));
            } else {
                while (i < count && !lines[i].isBlank() && Character.isWhitespace(lines[i].charAt(0))) {
                    ingredients.add(wholeStack(lines[i], i + 1));
                    i++;
                }
                if (ingredients.isEmpty()) {
                    throw new RecipeFormatException("recipe for " + result.getItem() + " lists no ingredients", headerLine);
                }
            }
            try {
                out.add(new Recipe(result, method == null ? defaultMethod : method, ingredients));
            } catch (IllegalArgumentException ex) {
                throw new RecipeFormatException(ex.getMessage(), headerLine);
            }
        }
        return out;
    }

    /** Parses a single {@code item (count)}, as typed on a command line. */
    public Stack parseStack(String text) throws RecipeFormatException {
        return wholeStack(text, 0);
    }

    private static Stack wholeStack(String text, int line) throws RecipeFormatException {
        Cursor c = new Cursor(text.strip(), line);
        Stack stack = c.readStack();
        if (!c.remaining().isBlank()) {
            throw new RecipeFormatException("unexpected text after stack: '" + c.remaining().trim() + "'", line);
        }
        return stack;
    }

    private static final class Cursor {
        private final String s;
        private final int line;
        private int pos;

        Cursor(String s, int line) { this.s = s; this.line = line; }

        Stack readStack() throws RecipeFormatException {
            int open = s.indexOf('(', pos);
            if (open < 0) throw error("expected '(count)' after item name");
            String name = s.substring(pos, open).trim();
            if (name.isEmpty()) throw error("missing item name");
            pos = open + 1;
            long count = readCount();
            expect(')');
            return new Stack(name, count);
        }

        /** Reads an optional {@code (method)}; null when there is none. */
        String readMethod() throws RecipeFormatException {
            skipSpaces();
            if (pos >= s.length() || s.charAt(pos) != '(') return null;
            int close = s.indexOf(')', pos + 1);
            if (close < 0) throw error("unclosed method name");
            String method = s.substring(pos + 1, close);
            if (method.isEmpty()) throw error("empty method name");
            pos = close + 1;
            return method;
        }

        long readCount() throws RecipeFormatException {
            if (pos >= s.length() || s.charAt(pos) < '0' || s.charAt(pos) > '9') throw error("expected a count");
            long value = 0;
            try {
                while (pos < s.length()) {
                    char ch = s.charAt(pos);
                    if (ch >= '0' && ch <= '9') value = Math.addExact(Math.multiplyExact(value, 10), ch - '0');
                    else if (ch != '_') break;
                    pos++;
                }
            } catch (ArithmeticException ex) {
                throw error("count is too large");
            }
            return value;
        }

        void expect(char ch) throws RecipeFormatException {
            skipSpaces();
            if (pos >= s.length() || s.charAt(pos) != ch) throw error("expected '" + ch + "'");
            pos++;
        }

        String remaining() { return s.substring(pos); }

        private void skipSpaces() {
            while (pos < s.length() && s.charAt(pos) == ' ') pos++;
        }

        private RecipeFormatException error(String message) {
            return new RecipeFormatException(message + " in '" + s + "'", line);
        }
    }
}
