package com.lintmux.dispatch.cli;

import com.lintmux.core.model.ChildSpec;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Lintmux CLI.
 * Not used by {@code serve}, whose stdout belongs to the host.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LINTMUX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LINTMUX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void root(String root, int pluginCount) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + root + "|@ (" + pluginCount + " plugin" + (pluginCount != 1 ? "s" : "") + ")"));
    }

    public static void plugin(ChildSpec spec) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [PLUGIN " + spec.name() + "]|@ " + String.join(" ", spec.command())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|faint " + spec.identity() + "|@"));
    }
}
