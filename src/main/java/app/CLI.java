package app;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import grid.FrameClusterer;
import io.FrameLoader;
import io.ImageWriter;
import model.CfaPattern;
import model.RawFrame;
import pipeline.BatchResult;
import pipeline.PipelineOrchestrator;
import pipeline.StitchResult;
import stages.ConvolutionDemosaicer;
import stages.Demosaicer;
import stages.DilationDemosaicer;
import stages.GpuDemosaicer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry: demosaics every raw frame in a directory, groups the frames into
 * 16-tile families and writes one stitched 4×4 composite (or 16 layers) per family.
 * Example:
 * # CPU, bilinear
 * java -jar raw-mosaic.jar --input=frames --output=out --pattern=RGGB
 *
 * # GPU requested (also auto-disables on battery <= 30%)
 * java -DuseGPU=true -jar raw-mosaic.jar --input=frames --layers
 */
public final class CLI {

    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    /** Composites were written, but at least one complete family could not be stitched. */
    static final int EXIT_PARTIAL = 3;

    // -------------------- Args --------------------
    static final class Args {
        @Parameter(names = "--input", description = "Directory of raw frame images (.png/.jpg/.bmp/.gif)", required = true)
        String input;

        @Parameter(names = "--output", description = "Directory for composites (default: input directory)")
        String output;

        @Parameter(names = "--demosaic", description = "convolution | dilation")
        String demosaic = "convolution";

        @Parameter(names = "--pattern", description = "CFA layout: RGGB | BGGR | GRBG | GBRG",
                converter = CfaPatternConverter.class)
        CfaPattern pattern = CfaPattern.RGGB;

        @Parameter(names = "--layers", description = "Write 16 transparent layers per family instead of one grid")
        boolean layers = false;

        @Parameter(names = "--gpu", description = "Use GPU acceleration (OpenCL). Also honored via -DuseGPU=true")
        boolean gpu = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    public static final class CfaPatternConverter implements IStringConverter<CfaPattern> {
        @Override
        public CfaPattern convert(String value) {
            try {
                return CfaPattern.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    private CLI() {
    }

    public static void main(String[] argv) {
        int status = run(argv);
        if (status != 0)
            System.exit(status);
    }

    static int run(String[] argv) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("raw-mosaic").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            System.err.println(pe.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }
        if (args.help) {
            jc.usage();
            return 0;
        }

        Demosaicer cpu;
        try {
            cpu = demosaicerFor(args.demosaic);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }

        // Read GPU preference from CLI flag OR JVM property (-DuseGPU=true)
        boolean userWantsGPU = args.gpu || Boolean.parseBoolean(System.getProperty("useGPU", "false"));
        Demosaicer gpu = cpu instanceof ConvolutionDemosaicer ? new GpuDemosaicer() : null;

        Path inDir = Paths.get(args.input);
        Path outDir = args.output != null ? Paths.get(args.output) : inDir;

        // Banner
        System.out.println("== RAW Mosaic ==");
        System.out.println("Input: " + inDir);
        System.out.println("Demosaic: " + cpu.name() + "  Pattern: " + args.pattern + "  GPU: " + userWantsGPU
                + "  Layers: " + args.layers);

        List<RawFrame> frames;
        try {
            frames = FrameLoader.loadDirectory(inDir, args.pattern);
        } catch (IOException e) {
            System.err.println("[FrameLoader] " + e.getMessage());
            return EXIT_IO;
        }

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(cpu, gpu, userWantsGPU,
                FrameClusterer.DEFAULT_CLUSTER_LENGTH);

        long t0 = System.nanoTime();
        BatchResult result;
        try {
            result = orchestrator.run(frames, args.layers);
        } catch (InterruptedException e) {
            System.err.println("Processing interrupted: " + e.getMessage());
            Thread.currentThread().interrupt();
            return EXIT_IO;
        }
        long totalMs = Math.round((System.nanoTime() - t0) / 1e6);

        try {
            int written = 0;
            for (StitchResult r : result.composites()) {
                for (int i = 0; i < r.images().size(); i++) {
                    Path out = outDir.resolve(fileName(r, i));
                    ImageWriter.writePng(r.images().get(i), out);
                    written++;
                }
            }
            System.out.println("Frames: " + frames.size() + "  Families: " + result.composites().size()
                    + "  Excluded: " + result.clustering().excludedIdentifiers().size()
                    + "  Incomplete: " + result.clustering().droppedGroups().size()
                    + "  Failed: " + result.failedFamilies().size());
            System.out.println("Total processing: " + totalMs + " ms");
            System.out.println("Wrote " + written + " image(s) to: " + outDir.toAbsolutePath());
        } catch (IOException e) {
            System.err.println("Failed to write composite: " + e.getMessage());
            return EXIT_IO;
        }
        if (result.hasFailures()) {
            result.failedFamilies().forEach((key, reason) ->
                    System.err.println("Family '" + key.value() + "' not stitched: " + reason));
            return EXIT_PARTIAL;
        }
        return 0;
    }

    static Demosaicer demosaicerFor(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "convolution", "bilinear" -> new ConvolutionDemosaicer();
            case "dilation" -> new DilationDemosaicer();
            default -> throw new IllegalArgumentException("Unknown demosaic algorithm: " + name);
        };
    }

    static String fileName(StitchResult r, int index) {
        String base = r.key().value().isEmpty() ? "family" : r.key().value();
        if (!r.layered())
            return base + "_grid.png";
        return String.format("%s_layer_%02d.png", base, index);
    }
}
