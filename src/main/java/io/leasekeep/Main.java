package io.leasekeep;

import io.leasekeep.cli.LeaseKeepCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LeaseKeepCommand()).execute(args);
        System.exit(code);
    }
}
