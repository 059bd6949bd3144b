package io.platoonmesh;

import io.platoonmesh.cli.PlatoonMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PlatoonMeshCommand()).execute(args);
        System.exit(code);
    }
}
