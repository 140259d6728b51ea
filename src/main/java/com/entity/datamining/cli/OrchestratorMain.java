package com.entity.datamining.cli;

import com.entity.datamining.config.OrchestratorOptions;
import com.entity.datamining.router.OrchestratorResponse;
import com.entity.datamining.router.RequestCodec;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Process entry point: handles one JSON request and prints one JSON response on stdout.
 *
 * <p>The request is taken from the first argument, or from stdin when no argument is given.
 * Logs go to stderr.</p>
 */
public final class OrchestratorMain {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorMain.class);

    private OrchestratorMain() {
    }

    public static void main(String[] args) {
        RequestCodec codec = new RequestCodec();
        String json;
        try {
            json = args.length > 0 ? args[0] : readStdin(System.in);
        } catch (IOException e) {
            System.out.println(codec.encode(OrchestratorResponse.failure(
                    "failed to read request: " + e.getMessage(), Instant.now())));
            System.exit(1);
            return;
        }

        OrchestratorOptions options = OrchestratorOptions.fromConfig(ConfigProvider.getConfig());
        try {
            Path parent = options.getDatabasePath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.error("main.databaseDirFailed path={} error={}", options.getDatabasePath(), e.getMessage());
        }

        int exitCode;
        try (Orchestrator orchestrator = Orchestrator.builder(options).build()) {
            exitCode = run(json, orchestrator, codec, System.out);
        } catch (RuntimeException e) {
            log.error("main.failed error={}", e.getMessage(), e);
            System.out.println(codec.encode(OrchestratorResponse.failure(
                    "orchestrator error: " + e.getMessage(), Instant.now())));
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Starts the worker, routes one request and prints the response.
     * The worker keeps draining enrichment tasks until the orchestrator is closed.
     *
     * @return 0 if the request was parsed and routed, 1 if the input was not valid JSON
     */
    static int run(String json, Orchestrator orchestrator, RequestCodec codec, PrintStream out) {
        RequestCodec.DecodeResult decoded = codec.decodeOrError(json);
        if (!decoded.isValid()) {
            out.println(codec.encode(decoded.error()));
            return 1;
        }
        orchestrator.start();
        OrchestratorResponse response = orchestrator.getRouter().route(decoded.request());
        out.println(codec.encode(response));
        out.flush();
        return 0;
    }

    private static String readStdin(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
