package io.loremesh.cli;

import io.loremesh.core.orchestration.SolutionRecord;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "solve", description = "Route a problem to an agent and record it")
public final class SolveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Problem description")
    String problem;

    @Option(names = {"-t", "--type"}, description = "Problem type", defaultValue = "general")
    String problemType;

    public SolveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LoremeshRuntime runtime = context.openRuntime()) {
            SolutionRecord record = runtime.orchestrator().solve(problem, problemType);
            System.out.println("Solved by: " + record.solvedBy());
            System.out.println("Status: " + record.status());
            return 0;
        } catch (Exception e) {
            System.err.println("Solve command failed: " + e.getMessage());
            return 1;
        }
    }
}
