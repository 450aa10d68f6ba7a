package dev.flowbulk;

import dev.flowbulk.cli.FlowAnalyzerCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowAnalyzerCli()).execute(args);
        System.exit(exitCode);
    }
}
