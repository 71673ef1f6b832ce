package com.lucidchart.pixelcompare;

/** ANSI escape codes used to color comparison summaries in a terminal */
public final class ConsoleColor {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private ConsoleColor() {}
}
