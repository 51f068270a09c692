package io.logtriage;

import io.logtriage.cli.LogTriageCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LogTriageCommand()).execute(args);
        System.exit(code);
    }
}
