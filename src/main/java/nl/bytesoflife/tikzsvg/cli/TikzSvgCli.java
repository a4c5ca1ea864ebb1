package nl.bytesoflife.tikzsvg.cli;

import nl.bytesoflife.tikzsvg.ConversionException;
import nl.bytesoflife.tikzsvg.TikzSvgConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point:
 * {@code convert <input> [output] [--width N] [--height N] [--scale S] [--fit M]}.
 * <p>
 * A document with several pictures is written to {@code name.svg}, {@code name-2.svg}, ...
 */
public class TikzSvgCli {

    private static final Logger log = LoggerFactory.getLogger(TikzSvgCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONVERSION_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE =
        "Usage: convert <input.tex> [output.svg] [--width N] [--height N] [--scale S] [--fit MARGIN]";

    public static void main(String[] args) {
        Locale.setDefault(Locale.US);
        System.exit(run(args));
    }

    public static int run(String[] args) {
        TikzSvgConverter converter = new TikzSvgConverter();
        List<String> positional = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--width":
                        converter.setWidth(number(args, ++i, arg));
                        break;
                    case "--height":
                        converter.setHeight(number(args, ++i, arg));
                        break;
                    case "--scale":
                        converter.setScale(number(args, ++i, arg));
                        break;
                    case "--fit":
                        converter.setFitToContent(number(args, ++i, arg));
                        break;
                    case "-h":
                    case "--help":
                        System.out.println(USAGE);
                        return EXIT_OK;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        positional.add(arg);
                        break;
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        if (!positional.isEmpty() && positional.get(0).equals("convert")) {
            positional.remove(0);
        }
        if (positional.isEmpty() || positional.size() > 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        Path input = Path.of(positional.get(0));
        Path output = positional.size() > 1 ? Path.of(positional.get(1)) : defaultOutput(input);
        return convert(converter, input, output);
    }

    private static int convert(TikzSvgConverter converter, Path input, Path output) {
        long start = System.currentTimeMillis();
        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", input, e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Read {} ({} chars)", input, source.length());

        List<String> documents;
        try {
            documents = converter.convertDocument(source);
        } catch (ConversionException e) {
            log.error("Conversion of {} failed: {}", input, e.getMessage());
            log.debug("Conversion error details", e);
            return EXIT_CONVERSION_FAILED;
        }
        if (documents.isEmpty()) {
            log.error("No tikzpicture found in {}", input);
            return EXIT_CONVERSION_FAILED;
        }
        log.info("Found {} picture(s)", documents.size());

        try {
            for (int i = 0; i < documents.size(); i++) {
                Path target = numbered(output, i + 1);
                Files.writeString(target, documents.get(i), StandardCharsets.UTF_8);
                log.info("Wrote {}", target);
            }
        } catch (IOException e) {
            log.error("Cannot write {}: {}", output, e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Done in {}ms", System.currentTimeMillis() - start);
        return EXIT_OK;
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".svg");
    }

    /** {@code out.svg} for the first picture, {@code out-2.svg} for the second and so on. */
    static Path numbered(Path output, int index) {
        if (index == 1) {
            return output;
        }
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String numbered = dot > 0
            ? name.substring(0, dot) + "-" + index + name.substring(dot)
            : name + "-" + index;
        return output.resolveSibling(numbered);
    }

    private static double number(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        try {
            return Double.parseDouble(args[index]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + args[index], e);
        }
    }
}
