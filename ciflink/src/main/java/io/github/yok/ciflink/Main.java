package io.github.yok.ciflink;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.ciflink.codec.CifReader;
import io.github.yok.ciflink.codec.CifWriter;
import io.github.yok.ciflink.codec.CsvCategoryExporter;
import io.github.yok.ciflink.codec.CsvCategoryReader;
import io.github.yok.ciflink.codec.DataFormat;
import io.github.yok.ciflink.codec.FlatJsonCodec;
import io.github.yok.ciflink.codec.HierarchicalDocumentCodec;
import io.github.yok.ciflink.config.CifLinkConfig;
import io.github.yok.ciflink.core.ConversionPipeline;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.util.ErrorHandler;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads one input, converts it with a {@link ConversionPipeline} and writes the result.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --input <path>} or {@code -i <path>}: input file. {@code .cif}/{@code .mmcif} is CIF
 * text, {@code .json}/{@code .yaml}/{@code .yml} a nested tree, {@code .xml} a PDBML-style
 * document, and a directory a CSV export. Required.</li>
 * <li>{@code --output <path>} or {@code -o <path>}: output file or directory. Defaults to the input
 * name with the extension of the output format.</li>
 * <li>{@code --format <fmt>} or {@code -f <fmt>}: {@code nested}, {@code yaml}, {@code flat},
 * {@code xml}, {@code cif} or {@code csv}. Defaults to {@code nested} for flat inputs and
 * {@code cif} for nested and XML inputs.</li>
 * <li>{@code --permissive}: permissive mode, overriding {@code ciflink.permissive}.</li>
 * <li>{@code --quiet}: progress at debug level, overriding {@code ciflink.quiet}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see CifLinkConfig
 * @see ConversionPipeline
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final CifLinkConfig config;

    /**
     * Bootstraps the application. Exits with {@link ErrorHandler#FAILURE_STATUS} if the
     * conversion reported an error.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
        int status = ErrorHandler.exitStatus();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String input = null;
        String output = null;
        String format = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--output":
                case "-o":
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--format":
                case "-f":
                    format = (i + 1 < args.length ? args[++i].toLowerCase(Locale.ROOT) : null);
                    break;
                case "--permissive":
                    config.setPermissive(true);
                    break;
                case "--quiet":
                    config.setQuiet(true);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (input == null || input.isEmpty()) {
            ErrorHandler.errorAndExit("Input file is required (--input).");
            return;
        }
        File inputFile = new File(input);
        if (!inputFile.exists()) {
            ErrorHandler.errorAndExit("Input file not found: " + inputFile.getAbsolutePath());
            return;
        }
        InputKind kind = InputKind.of(inputFile);
        if (kind == null) {
            ErrorHandler.errorAndExit("Unsupported input: " + inputFile.getName());
            return;
        }
        OutputFormat target = format == null ? kind.defaultOutput() : OutputFormat.of(format);
        if (target == null) {
            ErrorHandler.errorAndExit("Unknown output format: " + format);
            return;
        }
        File outputFile =
                output == null ? defaultOutput(inputFile, target) : new File(output);

        log.info("Input: {} ({}), Output: {} ({}), Mode: {}", inputFile, kind, outputFile,
                target, config.getMode());
        try (ConversionPipeline pipeline = new ConversionPipeline(config)) {
            DataContainer container = readInput(pipeline, inputFile, kind);
            writeOutput(pipeline, container, outputFile, target);
            log.info("Conversion completed: {}", outputFile.getAbsolutePath());
        } catch (Exception e) {
            log.error("Fatal error occurred (input={}): {}", inputFile, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private DataContainer readInput(ConversionPipeline pipeline, File file, InputKind kind)
            throws IOException {
        switch (kind) {
            case CIF:
                return new CifReader().read(file);
            case CSV:
                return new CsvCategoryReader().read(file);
            case XML:
                return pipeline.fromXml(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
            default:
                JsonNode tree = new HierarchicalDocumentCodec().read(file);
                return pipeline.flatten(tree);
        }
    }

    private void writeOutput(ConversionPipeline pipeline, DataContainer container, File file,
            OutputFormat target) throws IOException {
        switch (target) {
            case NESTED:
            case YAML:
                new HierarchicalDocumentCodec().write(pipeline.nest(container), file);
                break;
            case FLAT:
                new FlatJsonCodec().write(container, file);
                break;
            case XML:
                Map<String, String> documents = pipeline.toXml(container);
                for (Map.Entry<String, String> doc : documents.entrySet()) {
                    File xmlFile = documents.size() == 1 ? file
                            : new File(file.getParentFile(), FilenameUtils.getBaseName(
                                    file.getName()) + "_" + doc.getKey() + ".xml");
                    FileUtils.writeStringToFile(xmlFile, doc.getValue(), StandardCharsets.UTF_8);
                }
                break;
            case CIF:
                new CifWriter().write(container, file);
                break;
            default:
                new CsvCategoryExporter().export(container, file);
        }
    }

    private static File defaultOutput(File input, OutputFormat target) {
        String base = FilenameUtils.getBaseName(input.getName());
        File dir = input.getAbsoluteFile().getParentFile();
        return new File(dir, base + target.getSuffix());
    }

    /**
     * Kinds of input the command line accepts.
     */
    enum InputKind {
        CIF, CSV, NESTED, XML;

        static InputKind of(File file) {
            if (file.isDirectory()) {
                return CSV;
            }
            DataFormat format =
                    DataFormat.fromExtension(FilenameUtils.getExtension(file.getName()));
            if (format == null) {
                return null;
            }
            switch (format) {
                case CIF:
                    return CIF;
                case JSON:
                case YAML:
                    return NESTED;
                case XML:
                    return XML;
                default:
                    return null;
            }
        }

        OutputFormat defaultOutput() {
            return this == CIF || this == CSV ? OutputFormat.NESTED : OutputFormat.CIF;
        }
    }

    /**
     * Output formats of the {@code --format} option.
     */
    enum OutputFormat {
        NESTED(".json"), YAML(".yaml"), FLAT(".flat.json"), XML(".xml"), CIF(".cif"), CSV("_csv");

        private final String suffix;

        OutputFormat(String suffix) {
            this.suffix = suffix;
        }

        String getSuffix() {
            return suffix;
        }

        static OutputFormat of(String name) {
            for (OutputFormat f : values()) {
                if (f.name().equalsIgnoreCase(name)) {
                    return f;
                }
            }
            return null;
        }
    }
}
