package io.meshview;

import io.meshview.cli.MeshViewCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MeshViewCommand()).execute(args);
        System.exit(code);
    }
}
