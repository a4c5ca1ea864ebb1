package nl.bytesoflife.tikzsvg;

import nl.bytesoflife.tikzsvg.evaluator.MacroExpander;
import nl.bytesoflife.tikzsvg.model.Picture;
import nl.bytesoflife.tikzsvg.parser.TikzParser;
import nl.bytesoflife.tikzsvg.parser.TikzPreprocessor;
import nl.bytesoflife.tikzsvg.renderer.svg.SvgDocumentEmitter;
import nl.bytesoflife.tikzsvg.renderer.svg.SvgOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts TikZ source to SVG.
 * <p>
 * Usage:
 * <pre>
 * String svg = new TikzSvgConverter()
 *     .setWidth(800)
 *     .setHeight(600)
 *     .convert(source);
 * </pre>
 * Every call starts from a clean state: macros, variables and named coordinates never carry over
 * from one document to the next, so one converter may be reused and separate converters may run
 * on separate threads.
 */
public class TikzSvgConverter {

    private static final Logger log = LoggerFactory.getLogger(TikzSvgConverter.class);

    private final TikzPreprocessor preprocessor = new TikzPreprocessor();
    private SvgOptions options = SvgOptions.defaults();

    public TikzSvgConverter setWidth(double width) {
        options = options.withSize(width, options.getHeight());
        return this;
    }

    public TikzSvgConverter setHeight(double height) {
        options = options.withSize(options.getWidth(), height);
        return this;
    }

    /** Pixels per centimetre. */
    public TikzSvgConverter setScale(double scale) {
        options = options.withScale(scale);
        return this;
    }

    public TikzSvgConverter setFitToContent(double margin) {
        options = options.withFitToContent(margin);
        return this;
    }

    public TikzSvgConverter setMaxMacroDepth(int depth) {
        options = options.withMaxMacroDepth(depth);
        return this;
    }

    public TikzSvgConverter setOptions(SvgOptions options) {
        this.options = options;
        return this;
    }

    public SvgOptions getOptions() {
        return options;
    }

    /**
     * Converts the first picture of {@code source}.
     *
     * @throws ConversionException when the source holds no picture or cannot be converted
     */
    public String convert(String source) {
        List<String> documents = convertDocument(source);
        if (documents.isEmpty()) {
            throw new ConversionException("No tikzpicture found");
        }
        return documents.get(0);
    }

    /**
     * Converts every picture of a document, in order. Text between pictures is only scanned for
     * macro definitions, which stay in effect for the pictures after it.
     */
    public List<String> convertDocument(String source) {
        long start = System.currentTimeMillis();
        String text = preprocessor.stripComments(source);
        MacroExpander macros = new MacroExpander(options.getMaxMacroDepth());

        List<String> result = new ArrayList<>();
        for (TikzPreprocessor.Segment segment : preprocessor.split(text)) {
            String expanded = macros.expand(segment.text());
            if (!segment.diagram()) {
                continue;
            }
            if (expanded.isBlank()) {
                log.debug("Skipping empty picture");
                continue;
            }
            log.debug("Expanded picture {} to {} characters with {} macro(s)",
                result.size() + 1, expanded.length(), macros.getMacroCount());
            result.add(convertPicture(new TikzParser().parse(expanded)));
        }
        log.debug("Converted {} picture(s) in {} ms", result.size(), System.currentTimeMillis() - start);
        return result;
    }

    /** Renders an already parsed picture. */
    public String convertPicture(Picture picture) {
        return new SvgDocumentEmitter(options).emit(picture);
    }
}
