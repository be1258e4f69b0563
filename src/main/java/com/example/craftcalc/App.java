package com.example.craftcalc;

import com.example.craftcalc.engine.Calculator;
import com.example.craftcalc.storage.Settings;
import com.example.craftcalc.storage.SettingsStorage;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Entry point: preloads recipe files or a saved session, then starts the shell. */
public class App {

    static class Options {
        final List<String> recipeFiles = new ArrayList<>();
        String session;
        boolean help;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "-r": case "--recipes":
                        o.recipeFiles.add(value(args, ++i, a));
                        break;
                    case "-s": case "--session":
                        o.session = value(args, ++i, a);
                        break;
                    case "-h": case "--help":
                        o.help = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + a);
                }
            }
            return o;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new IllegalArgumentException(flag + " needs a file");
            return args[i];
        }
    }

    static final String USAGE = "Usage: crafting-calculator [-r|--recipes <file>]... [-s|--session <file>]";

    public static void main(String[] args) throws IOException {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }
        if (options.help) {
            System.out.println(USAGE);
            return;
        }

        SettingsStorage settingsStorage = new SettingsStorage();
        Settings settings = settingsStorage.load();
        Shell shell = new Shell(new Calculator(), settings, settingsStorage,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8)));
        if (options.session != null) shell.execute("open " + options.session);
        for (String f : options.recipeFiles) shell.execute("load " + f);
        shell.run();
    }
}
