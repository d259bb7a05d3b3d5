package io.loremesh.cli;

import io.loremesh.core.federation.KnowledgeBundle;
import io.loremesh.core.federation.KnowledgeBundleReader;
import io.loremesh.core.federation.RepoId;
import io.loremesh.core.federation.SyncResult;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "sync", description = "Register a knowledge bundle as synced from one repository to the other")
public final class SyncCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Knowledge bundle JSON file")
    Path bundle;

    @Option(names = {"-s", "--source"}, description = "Source repository (A or B)", defaultValue = "A")
    RepoId source;

    public SyncCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LoremeshRuntime runtime = context.openRuntime()) {
            KnowledgeBundle read = new KnowledgeBundleReader().read(bundle, source);
            SyncResult result = runtime.ledger().syncBatch(read.entries(), source, source.opposite());
            System.out.println("Direction: " + result.direction().label());
            System.out.println("Synced: " + result.synced());
            System.out.println("Conflicts: " + result.conflicts());
            System.out.println("Errors: " + (result.errors() + read.malformed()));
            System.out.println("Categories: " + read.categories());
            System.out.println("Average confidence: " + String.format(Locale.ROOT, "%.2f", read.averageConfidence()));
            return 0;
        } catch (Exception e) {
            System.err.println("Sync command failed: " + e.getMessage());
            return 1;
        }
    }
}
