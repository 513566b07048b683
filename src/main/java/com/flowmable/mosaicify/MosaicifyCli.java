package com.flowmable.mosaicify;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line driver.
 * <pre>
 * mosaicify TARGET ROW_SIZE COL_SIZE IMAGES [-c rgb|lab|gray] [-o mosaic.jpg] [-d]
 * </pre>
 */
public class MosaicifyCli {

    private static final Logger logger = LoggerFactory.getLogger(MosaicifyCli.class);

    static final String PROGRAM = "mosaicify";
    static final String VERSION = "0.3.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Parameters(commandDescription = "Generates a mosaic image from a target image and a set of source images.")
    static class Params {

        @Parameter(description = "TARGET ROW_SIZE COL_SIZE IMAGES")
        List<String> positional = new ArrayList<>();

        @Parameter(names = {"-c", "--color_space"}, converter = ColorSpaceConverter.class,
                description = "Color space to use for matching tiles: 'rgb' for RGB space, 'lab' for Lab space, 'gray' for grayscale.")
        ColorSpace colorSpace = MosaicSettings.DEFAULT_COLOR_SPACE;

        @Parameter(names = {"-o", "--output"}, description = "Output image file path")
        String output = "mosaic.jpg";

        @Parameter(names = {"-d", "--avoid-duplicates"}, description = "Avoid using duplicate images in the mosaic")
        boolean avoidDuplicates = false;

        @Parameter(names = "--seed", description = "Seed for the cell visiting order (reproducible output)")
        Long seed;

        @Parameter(names = "--threads", description = "Number of worker threads")
        int threads = Runtime.getRuntime().availableProcessors();

        @Parameter(names = {"-h", "--help"}, description = "Display this note", help = true)
        boolean help;

        @Parameter(names = {"-V", "--version"}, description = "Print version information")
        boolean version;

        Path target;
        int rowSize;
        int colSize;
        Path images;

        /** Split and type-check the positional arguments. */
        void resolvePositional() {
            if (positional.size() != 4) {
                throw new ParameterException("Expected 4 positional arguments (TARGET ROW_SIZE COL_SIZE IMAGES), got "
                        + positional.size());
            }
            target = Path.of(positional.get(0));
            rowSize = parseCount("ROW_SIZE", positional.get(1));
            colSize = parseCount("COL_SIZE", positional.get(2));
            images = Path.of(positional.get(3));
        }

        MosaicSettings toSettings() {
            return new MosaicSettings(rowSize, colSize, colorSpace, avoidDuplicates, seed, threads);
        }

        private static int parseCount(String name, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new ParameterException(name + " must be an integer, got '" + value + "'");
            }
        }
    }

    public static class ColorSpaceConverter implements IStringConverter<ColorSpace> {
        @Override
        public ColorSpace convert(String value) {
            try {
                return ColorSpace.fromId(value);
            } catch (MosaicConfigException e) {
                throw new ParameterException("Invalid color space '" + value + "'. Options: rgb, lab, gray");
            }
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Params params = new Params();
        JCommander jc = JCommander.newBuilder().addObject(params).programName(PROGRAM).build();
        try {
            jc.parse(args);
            if (params.help) {
                jc.usage();
                return EXIT_OK;
            }
            if (params.version) {
                out.println(PROGRAM + " " + VERSION);
                return EXIT_OK;
            }
            params.resolvePositional();
        } catch (ParameterException e) {
            err.println("error: " + e.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }

        try {
            MosaicGenerator generator = new MosaicGenerator(params.toSettings(), new ConsoleProgress(out));
            MosaicResult result = generator.generate(params.target, params.images, Path.of(params.output));
            out.printf("Mosaic %dx%d written to %s (%d distinct tiles).%n",
                    result.image().width(), result.image().height(), params.output, result.distinctTiles());
            out.println("All done.");
            return EXIT_OK;
        } catch (MosaicException e) {
            logger.debug("Run failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** Single-line progress bar per stage. */
    static final class ConsoleProgress implements ProgressListener {

        private static final int BAR_WIDTH = 40;

        private final PrintStream out;
        private Stage current;
        private int lastFilled = -1;

        ConsoleProgress(PrintStream out) {
            this.out = out;
        }

        @Override
        public synchronized void onProgress(Stage stage, int done, int total) {
            if (stage != current) {
                current = stage;
                lastFilled = -1;
            }
            int filled = total == 0 ? BAR_WIDTH : (int) ((long) done * BAR_WIDTH / total);
            if (filled == lastFilled && done != total) {
                return;
            }
            lastFilled = filled;
            out.printf("\r%-22s [%s%s] %d/%d", stage.label(),
                    "#".repeat(filled), " ".repeat(BAR_WIDTH - filled), done, total);
            if (done == total) {
                out.println();
            }
            out.flush();
        }
    }
}
