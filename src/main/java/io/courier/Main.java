package io.courier;

import io.courier.cli.CourierCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CourierCommand()).execute(args);
        System.exit(code);
    }
}
