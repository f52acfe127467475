package promptgrid;

import promptgrid.cli.PromptGridCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PromptGridCommand()).execute(args);
        System.exit(code);
    }
}
