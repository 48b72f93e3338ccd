package io.sunplane;

import io.sunplane.cli.SunCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = SunCommand.commandLine(new SunCommand()).execute(args);
        System.exit(code);
    }
}
