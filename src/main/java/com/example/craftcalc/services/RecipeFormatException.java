package com.example.craftcalc.services;

/** Recipe text that does not follow the recipe file format. */
public class RecipeFormatException extends Exception {
    private final int line;

    public RecipeFormatException(String message, int line) {
        super(line > 0 ? "line " + line + ": " + message : message);
        this.line = line;
    }

    /** 1-based line of the problem, or 0 when the input was not a file. */
    public int getLine() { return line; }
}
