package com.ttennebkram.intensity;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.ttennebkram.intensity.config.EngineSettings;
import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.model.TransformParameters;
import com.ttennebkram.intensity.processing.TransformEngine;
import com.ttennebkram.intensity.processing.TransformException;
import com.ttennebkram.intensity.processing.TransformResult;
import com.ttennebkram.intensity.processing.TransformStrategy;
import com.ttennebkram.intensity.processing.WorkerPool;
import com.ttennebkram.intensity.registry.StrategyRegistry;
import com.ttennebkram.intensity.util.MatBuffers;
import com.ttennebkram.intensity.util.OpenCVLoader;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Command line front end for the brightness/contrast engine.
 * Examples:
 * # Adjust one image
 * java -jar intensity-transform.jar --input in.png --output out.png --scale 1.4 --offset -20
 *
 * # Pick a strategy by name
 * java -jar intensity-transform.jar --input in.png --output out.png --strategy "Own (Sequential)"
 *
 * # List strategies, or time all of them on a synthetic 640x480 frame
 * java -jar intensity-transform.jar --list
 * java -jar intensity-transform.jar --benchmark 50
 */
public final class IntensityTransformLauncher {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final int SYNTHETIC_WIDTH = 640;
    private static final int SYNTHETIC_HEIGHT = 480;

    // -------------------- Args --------------------
    static final class Args {
        @Parameter(names = "--input", description = "Input image path (anything OpenCV can read)")
        String input;

        @Parameter(names = "--output", description = "Output image path; omit to only time the transform")
        String output;

        @Parameter(names = "--strategy", description = "Strategy name, see --list")
        String strategy;

        @Parameter(names = "--scale", description = "Contrast factor")
        Double scale;

        @Parameter(names = "--offset", description = "Brightness offset")
        Double offset;

        @Parameter(names = "--config", description = "Settings JSON overriding the bundled defaults")
        String config;

        @Parameter(names = "--list", description = "List registered strategies and exit")
        boolean list = false;

        @Parameter(names = "--benchmark", description = "Time every strategy over N calls")
        int benchmark = 0;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    private IntensityTransformLauncher() {
    }

    public static void main(String[] argv) {
        System.exit(run(argv, System.out, System.err));
    }

    /**
     * Run the launcher and return the process exit code.
     */
    static int run(String[] argv, PrintStream out, PrintStream err) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("intensity-transform").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            err.println(pe.getMessage());
            printUsage(jc, err);
            return EXIT_USAGE;
        }
        if (args.help) {
            printUsage(jc, out);
            return EXIT_OK;
        }

        EngineSettings settings;
        try {
            settings = args.config != null
                    ? EngineSettings.load(Paths.get(args.config))
                    : EngineSettings.loadDefaults();
        } catch (IOException e) {
            err.println("Cannot read settings " + args.config + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        WorkerPool pool = settings.getWorkerThreads() > 0
                ? new WorkerPool(settings.getWorkerThreads())
                : WorkerPool.shared();
        try {
            StrategyRegistry registry = StrategyRegistry.createDefault(pool);

            if (args.list) {
                for (String name : registry.names()) {
                    out.println(name);
                }
                return EXIT_OK;
            }

            String strategyName = args.strategy != null ? args.strategy : settings.getDefaultStrategy();
            if (!registry.contains(strategyName)) {
                err.println("Unknown strategy '" + strategyName + "'. Available: " + registry.names());
                return EXIT_USAGE;
            }

            TransformParameters params = TransformParameters.of(
                    args.scale != null ? args.scale : settings.getParameters().getScale(),
                    args.offset != null ? args.offset : settings.getParameters().getOffset());
            if (!params.isFinite()) {
                err.println("Scale and offset must be finite numbers");
                return EXIT_USAGE;
            }
            warnIfOutsideControlRange(settings, params, err);

            TransformEngine engine = new TransformEngine(registry, settings.getDefaultStrategy());

            if (args.benchmark > 0) {
                return runBenchmark(engine, args, params, out, err);
            }
            if (args.input == null) {
                err.println("--input is required unless --list or --benchmark is given");
                printUsage(jc, err);
                return EXIT_USAGE;
            }
            return runSingle(engine, strategyName, args, params, out, err);
        } catch (TransformException e) {
            err.println("Transform failed: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            pool.close();
        }
    }

    private static int runSingle(TransformEngine engine, String strategyName, Args args,
                                 TransformParameters params, PrintStream out, PrintStream err) {
        PixelBuffer source = readImage(args.input, err);
        if (source == null) {
            return EXIT_FAILURE;
        }

        TransformResult result = engine.applyTimed(strategyName, source, params);
        out.printf(Locale.ROOT, "Brightness/Contrast: %.2f ms (%s, %s, %s)%n",
                result.getElapsedMillis(), result.getStrategyName(), params, source.describe());

        if (args.output != null) {
            Mat mat = MatBuffers.toMat(result.getOutput());
            try {
                if (!Imgcodecs.imwrite(args.output, mat)) {
                    err.println("Failed to write " + args.output);
                    return EXIT_FAILURE;
                }
            } catch (CvException e) {
                err.println("Failed to write " + args.output + ": " + e.getMessage());
                return EXIT_FAILURE;
            } finally {
                mat.release();
            }
            out.println("Wrote " + args.output);
        }
        return EXIT_OK;
    }

    private static int runBenchmark(TransformEngine engine, Args args, TransformParameters params,
                                    PrintStream out, PrintStream err) {
        PixelBuffer source;
        if (args.input != null) {
            source = readImage(args.input, err);
            if (source == null) {
                return EXIT_FAILURE;
            }
        } else {
            source = PixelBuffer.allocate(SYNTHETIC_WIDTH, SYNTHETIC_HEIGHT);
            new Random(42).nextBytes(source.data());
        }

        // The OpenCV reference cannot run without its native library
        StrategyRegistry registry = engine.getRegistry();
        boolean needsOpenCV = false;
        for (String name : registry.names()) {
            TransformStrategy strategy = registry.require(name);
            needsOpenCV |= strategy.isReference();
        }
        if (needsOpenCV && !OpenCVLoader.tryLoad()) {
            err.println("OpenCV unavailable, benchmark needs it for the reference strategy");
            return EXIT_FAILURE;
        }

        out.printf(Locale.ROOT, "Benchmark: %s, %s, %d iterations%n", source.describe(), params, args.benchmark);
        Map<String, Double> means = engine.benchmark(source, params, args.benchmark);
        for (Map.Entry<String, Double> entry : means.entrySet()) {
            out.printf(Locale.ROOT, "  %-22s %8.3f ms%n", entry.getKey(), entry.getValue());
        }
        return EXIT_OK;
    }

    private static PixelBuffer readImage(String path, PrintStream err) {
        if (!OpenCVLoader.tryLoad()) {
            err.println("OpenCV unavailable, cannot read " + path);
            return null;
        }
        Mat mat;
        try {
            mat = Imgcodecs.imread(path);
        } catch (CvException e) {
            err.println("Cannot read image " + path + ": " + e.getMessage());
            return null;
        }
        try {
            if (mat.empty()) {
                err.println("Cannot read image " + path);
                return null;
            }
            return MatBuffers.fromMat(mat);
        } catch (CvException e) {
            err.println("Cannot read image " + path + ": " + e.getMessage());
            return null;
        } finally {
            mat.release();
        }
    }

    private static void warnIfOutsideControlRange(EngineSettings settings, TransformParameters params,
                                                  PrintStream err) {
        if (!settings.getContrastRange().contains(params.getScale())) {
            err.println("Note: scale " + params.getScale() + " is outside the usual range "
                    + settings.getContrastRange());
        }
        if (!settings.getBrightnessRange().contains(params.getOffset())) {
            err.println("Note: offset " + params.getOffset() + " is outside the usual range "
                    + settings.getBrightnessRange());
        }
    }

    private static void printUsage(JCommander jc, PrintStream stream) {
        StringBuilder sb = new StringBuilder();
        jc.getUsageFormatter().usage(sb);
        stream.print(sb);
    }
}
