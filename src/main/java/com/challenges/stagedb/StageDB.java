package com.challenges.stagedb;

import com.challenges.stagedb.output.ResultFormatter;
import com.challenges.stagedb.persistence.JsonStorageEngine;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.PipelineOverflowException;
import com.challenges.stagedb.pipeline.TraceLevel;
import com.challenges.stagedb.storage.InMemoryRowStore;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.StoreException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "stagedb", mixinStandardHelpOptions = true, version = "1.0",
         description = "Run SQL statements against an in-memory database")
public class StageDB implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-e", "--execute"}, description = "Statement to run (repeatable)")
    private String[] statements;

    @Option(names = {"-f", "--file"}, description = "Script of ';'-separated statements (default: stdin)")
    private Path scriptFile;

    @Option(names = {"-l", "--load"}, description = "Database file to load before running")
    private Path loadFile;

    @Option(names = "--max-iterations", description = "Pipeline iterations allowed per statement (default: ${DEFAULT-VALUE})")
    private int maxIterations = EngineConfig.defaults().maxIterations();

    @Option(names = "--trace-level", description = "NONE, MINIMAL or DETAILED (default: ${DEFAULT-VALUE})")
    private TraceLevel traceLevel = TraceLevel.MINIMAL;

    @Option(names = "--production-errors", description = "Hide pipeline details in error messages")
    private boolean productionErrors = false;

    @Option(names = "--format", description = "TAB or BOX (default: ${DEFAULT-VALUE})")
    private ResultFormatter.Style style = ResultFormatter.Style.TAB;

    private InputStream stdin = System.in;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new StageDB()).execute(args);
        System.exit(exitCode);
    }

    StageDB withStdin(InputStream in) {
        this.stdin = in;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RowStore store = new InMemoryRowStore();
            if (loadFile != null) {
                new JsonStorageEngine().loadInto(store, loadFile);
            }
            EngineConfig config = EngineConfig.defaults()
                .withMaxIterations(maxIterations)
                .withTraceLevel(traceLevel)
                .withProductionErrors(productionErrors)
                .withStyle(style);
            QueryEngine engine = new QueryEngine(store, config);

            boolean failed = false;
            for (String result : run(engine)) {
                out.println(result);
                failed |= result.startsWith(Payload.Terminal.ERROR_PREFIX);
            }
            out.flush();
            return failed ? 1 : 0;
        } catch (IOException | PipelineOverflowException | StoreException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private ImmutableList<String> run(QueryEngine engine) throws IOException {
        MutableList<String> results = Lists.mutable.empty();
        if (statements != null) {
            for (String statement : statements) {
                results.add(engine.execute(statement));
            }
        }
        if (scriptFile != null) {
            results.addAllIterable(engine.executeScript(Files.readString(scriptFile)));
        } else if (statements == null) {
            results.addAllIterable(engine.executeScript(new String(stdin.readAllBytes(), StandardCharsets.UTF_8)));
        }
        return results.toImmutable();
    }
}
