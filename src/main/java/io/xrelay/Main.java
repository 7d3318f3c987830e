package io.xrelay;

import io.xrelay.cli.XRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new XRelayCommand()).execute(args);
        System.exit(code);
    }
}
