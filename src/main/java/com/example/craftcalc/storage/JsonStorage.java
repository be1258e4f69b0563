package com.example.craftcalc.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.example.craftcalc.engine.Calculator;
import com.example.craftcalc.model.*;
import com.example.craftcalc.model.Stack;
import java.io.*;
import java.util.*;

/** JSON persistence for recipe lists and whole calculator sessions. */
public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Everything needed to rebuild a calculator. */
    public static class Session {
        public Stack target;
        public List<Stack> resources = new ArrayList<>();
        public List<Recipe> recipes = new ArrayList<>();
    }

    /**
     * Reads either a JSON array of recipes or a session object; a session must carry a
     * {@code recipes} list.
     */
    public List<Recipe> loadRecipes(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse recipes JSON: " + ex.getMessage(), ex);
        }
        if (root != null && root.isArray()) {
            try {
                return mapper.readerFor(new TypeReference<List<Recipe>>() {}).readValue(root);
            } catch (IOException ex) {
                throw new IOException("Invalid recipe in JSON array: " + ex.getMessage(), ex);
            }
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Failed to parse recipes JSON. Provide an array of recipes or a session {\"recipes\":[...] }.");
        }
        if (!root.hasNonNull("recipes")) {
            throw new IOException("Session JSON has no \"recipes\" list");
        }
        Session wrap;
        try {
            wrap = mapper.treeToValue(root, Session.class);
        } catch (IOException ex) {
            throw new IOException("Invalid session JSON: " + ex.getMessage(), ex);
        }
        return wrap.recipes;
    }

    public Session loadSession(InputStream in) throws IOException {
        Session s;
        try {
            s = mapper.readValue(in, Session.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse session JSON. Expect { target: {item, count}, resources: [..], recipes: [..] }", ex);
        }
        if (s == null) throw new IOException("Session JSON is empty");
        return s;
    }

    /** Rebuilds a calculator: recipes first, then resources, then the target. */
    public Calculator restore(Session s) {
        Calculator calc = new Calculator();
        if (s.recipes != null) calc.addRecipes(s.recipes);
        if (s.resources != null) for (Stack r : s.resources) calc.addResource(r);
        if (s.target != null) calc.setTarget(s.target);
        return calc;
    }

    public Calculator loadCalculator(File f) throws IOException {
        try (InputStream in = new FileInputStream(f)) {
            return restore(loadSession(in));
        }
    }

    public Session snapshot(Calculator calc) {
        Session s = new Session();
        s.target = calc.hasTarget() ? calc.getTarget() : null;
        s.resources = new ArrayList<>(calc.getResources());
        s.recipes = new ArrayList<>(calc.getRecipes());
        return s;
    }

    public void saveCalculator(Calculator calc, File f) throws IOException {
        mapper.writeValue(f, snapshot(calc));
    }

    public void saveRecipes(Collection<Recipe> recipes, OutputStream out) throws IOException {
        mapper.writeValue(out, new ArrayList<>(recipes));
    }
}
