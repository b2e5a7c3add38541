package com.helios.sketchbook;

import com.helios.sketchbook.core.consistency.ConsistencyChecker;
import com.helios.sketchbook.core.consistency.ConsistencyReport;
import com.helios.sketchbook.core.error.SketchException;
import com.helios.sketchbook.core.inference.InferenceResults;
import com.helios.sketchbook.core.inference.InferenceSolver;
import com.helios.sketchbook.core.inference.InferenceType;
import com.helios.sketchbook.engine.explicit.ExplicitEngine;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.infrastructure.telemetry.TracingService;
import com.helios.sketchbook.io.AeonSketchFormat;
import com.helios.sketchbook.io.SketchJsonFormat;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.VarId;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point: loads a sketch, checks it and runs inference on it.
 *
 * <pre>
 * SketchbookApplication &lt;sketch.json|sketch.aeon&gt; [--type=FULL|STATIC|DYNAMIC] [--config=file.properties]
 *                       [--witnesses=N] [--seed=S]
 * </pre>
 *
 * With {@code --witnesses}, up to N satisfying networks are sampled (seed 0 unless given) and printed
 * after the summary.
 */
public class SketchbookApplication {
    private static final Logger logger = Logger.getLogger(SketchbookApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        configureLogging();
        System.exit(new SketchbookApplication().run(args));
    }

    int run(String[] args) {
        Path sketchPath = null;
        InferenceType type = null;
        String configPath = null;
        int witnessCount = 0;
        long seed = 0;
        for (String arg : args) {
            if (arg.startsWith("--type=")) {
                type = InferenceType.fromString(arg.substring("--type=".length()));
                if (type == null) {
                    return usage("Unknown inference type: " + arg);
                }
            } else if (arg.startsWith("--config=")) {
                configPath = arg.substring("--config=".length());
            } else if (arg.startsWith("--witnesses=")) {
                try {
                    witnessCount = Integer.parseInt(arg.substring("--witnesses=".length()));
                } catch (NumberFormatException e) {
                    return usage("Invalid witness count: " + arg);
                }
                if (witnessCount < 0) {
                    return usage("Invalid witness count: " + arg);
                }
            } else if (arg.startsWith("--seed=")) {
                try {
                    seed = Long.parseLong(arg.substring("--seed=".length()));
                } catch (NumberFormatException e) {
                    return usage("Invalid seed: " + arg);
                }
            } else if (arg.startsWith("--")) {
                return usage("Unknown option: " + arg);
            } else if (sketchPath == null) {
                sketchPath = Paths.get(arg);
            } else {
                return usage("Only one sketch file can be given");
            }
        }
        if (sketchPath == null) {
            return usage("Missing sketch file");
        }

        InferenceConfig config = configPath != null
                ? InferenceConfig.loadFromProperties(configPath)
                : InferenceConfig.fromEnvironment();
        if (type != null) {
            config = config.toBuilder().inferenceType(type).build();
        }

        try {
            Sketch sketch = load(sketchPath);
            ConsistencyReport report = new ConsistencyChecker(sketch).checkConsistency();
            if (!report.passed()) {
                System.err.println(report.message());
                return EXIT_FAILURE;
            }
            InferenceSolver solver = new InferenceSolver(new ExplicitEngine(config), config,
                    TracingService.getInstance().getTracer());
            InferenceResults results = solver.run(sketch);
            System.out.println(results.summary());
            if (witnessCount > 0) {
                System.out.print(formatWitnesses(solver.sampleWitnesses(witnessCount, seed)));
            }
            return EXIT_OK;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Could not read sketch " + sketchPath, e);
            return EXIT_FAILURE;
        } catch (SketchException e) {
            logger.log(Level.SEVERE, "Inference failed: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static String formatWitnesses(List<Map<VarId, String>> witnesses) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < witnesses.size(); i++) {
            out.append("Witness ").append(i + 1).append(":\n");
            witnesses.get(i).forEach((var, fn) -> out.append("  $").append(var).append(": ").append(fn).append('\n'));
        }
        return out.toString();
    }

    static Sketch load(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase();
        if (fileName.endsWith(".aeon")) {
            return new AeonSketchFormat().read(path);
        }
        return new SketchJsonFormat().read(path);
    }

    private static int usage(String problem) {
        System.err.println(problem);
        System.err.println("Usage: SketchbookApplication <sketch.json|sketch.aeon> "
                + "[--type=FULL|STATIC|DYNAMIC] [--config=file.properties] [--witnesses=N] [--seed=S]");
        return EXIT_USAGE;
    }

    private static void configureLogging() {
        try (InputStream is = SketchbookApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
