package com.magicfolder.dispatch.cli;

import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.ClassificationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the MagicFolder CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MAGICFOLDER CLASSIFIER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MAGICFOLDER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void result(ClassificationResult result) {
        String color = result.category() == Category.MISC ? "fg(white)" : "fg(green)";
        String line = "  @|" + color + " " + String.format("%-13s", result.category().label()) + "|@ " + result.path();
        if (result.error() != null) {
            line += " @|fg(red) (" + result.error() + ")|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }
}
