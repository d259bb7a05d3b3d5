package io.loremesh.cli;

import io.loremesh.core.federation.FederationReport;
import io.loremesh.core.federation.KnowledgeBundle;
import io.loremesh.core.federation.KnowledgeBundleReader;
import io.loremesh.core.federation.RepoId;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "federate", description = "Resolve conflicts between two bundles and sync both directions")
public final class FederateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Bundle exported by repository A")
    Path bundleA;

    @Parameters(index = "1", arity = "1", description = "Bundle exported by repository B")
    Path bundleB;

    public FederateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LoremeshRuntime runtime = context.openRuntime()) {
            KnowledgeBundleReader reader = new KnowledgeBundleReader();
            KnowledgeBundle fromA = reader.read(bundleA, RepoId.A);
            KnowledgeBundle fromB = reader.read(bundleB, RepoId.B);
            FederationReport report = runtime.federation().federate(fromA.entries(), fromB.entries());
            System.out.println(report.aToB().direction().label() + ": " + report.aToB().synced());
            System.out.println(report.bToA().direction().label() + ": " + report.bToA().synced());
            System.out.println("Conflicts resolved: " + report.conflicts());
            System.out.println("Errors: " + (report.errors() + fromA.malformed() + fromB.malformed()));
            return 0;
        } catch (Exception e) {
            System.err.println("Federate command failed: " + e.getMessage());
            return 1;
        }
    }
}
