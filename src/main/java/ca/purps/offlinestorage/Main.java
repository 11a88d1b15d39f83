package ca.purps.offlinestorage;

import ca.purps.offlinestorage.cli.ArchiveSubcommand;
import ca.purps.offlinestorage.cli.ImportSubcommand;
import ca.purps.offlinestorage.cli.WorkerSubcommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "offline-storage",
        mixinStandardHelpOptions = true,
        description = "Offline manga download and storage engine",
        subcommands = { WorkerSubcommand.class, ArchiveSubcommand.class, ImportSubcommand.class })
public class Main implements Runnable {

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args));
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.err);
    }

}
