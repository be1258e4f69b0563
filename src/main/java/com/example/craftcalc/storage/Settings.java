package com.example.craftcalc.storage;

public class Settings {
    // Method given to recipes whose text names none
    public String defaultMethod;
    public String lastSessionPath;
}
