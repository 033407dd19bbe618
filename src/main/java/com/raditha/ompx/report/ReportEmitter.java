package com.raditha.ompx.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.ompx.model.EntryKind;
import com.raditha.ompx.model.ReportEntry;
import com.raditha.ompx.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders source units as JSON documents and writes them to disk.
 * <p>
 * A document maps {@code "<kind> - object id : <id>"} to the entry's fields in
 * emission order. Scalar fields are strings and list fields are arrays of strings.
 */
public class ReportEmitter {

    private static final Logger logger = LoggerFactory.getLogger(ReportEmitter.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String REPORT_SUFFIX = ".json";

    private final Path outputDirectory;
    private final Path sourceRoot;

    /**
     * @param outputDirectory directory for all reports, or {@code null} to write
     *                        each report next to its source file
     * @param sourceRoot      directory source file names are resolved against,
     *                        {@code null} for the working directory
     */
    public ReportEmitter(Path outputDirectory, Path sourceRoot) {
        this.outputDirectory = outputDirectory;
        this.sourceRoot = sourceRoot;
    }

    public ReportEmitter(Path outputDirectory) {
        this(outputDirectory, null);
    }

    /**
     * Build the JSON document of a unit.
     */
    public ObjectNode render(SourceUnit unit) {
        ObjectNode document = mapper.createObjectNode();
        for (ReportEntry entry : unit.getEntries()) {
            ObjectNode fields = document.putObject(entry.key());
            for (Map.Entry<String, Object> field : entry.fields().entrySet()) {
                if (field.getValue() instanceof List<?> values) {
                    ArrayNode array = fields.putArray(field.getKey());
                    values.forEach(value -> array.add(String.valueOf(value)));
                } else {
                    fields.put(field.getKey(), String.valueOf(field.getValue()));
                }
            }
        }
        return document;
    }

    public String renderToString(SourceUnit unit) {
        return toPrettyString(render(unit));
    }

    /**
     * Pretty-printed form of a rendered document.
     */
    public static String toPrettyString(ObjectNode document) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Report path of a source file: {@code <file>.json} beside the source under
     * the source root, or the file's base name plus the suffix inside the
     * output directory.
     */
    public Path outputPathFor(String filename) {
        if (outputDirectory == null) {
            Path report = Path.of(filename + REPORT_SUFFIX);
            return sourceRoot == null ? report : sourceRoot.resolve(report);
        }
        Path fileName = Path.of(filename).getFileName();
        return outputDirectory.resolve((fileName == null ? filename : fileName.toString()) + REPORT_SUFFIX);
    }

    /**
     * Render and write the report of a unit. A failed write is logged and
     * reported through {@link UnitReport#written()}; it never stops the run.
     */
    public UnitReport flush(SourceUnit unit) {
        ObjectNode document = render(unit);
        Path output = outputPathFor(unit.getFilename());
        int loops = (int) unit.getEntries().stream().filter(e -> e.kind() == EntryKind.LOOP).count();
        int directives = unit.getEntries().size() - loops;

        boolean written = false;
        if (unit.getFilename() == null || unit.getFilename().isEmpty()) {
            logger.error("Cannot write report for a unit without a file name");
        } else {
            try {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                mapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), document);
                written = true;
                logger.info("Pragma info for file {} written to {}", unit.getFilename(), output);
            } catch (IOException e) {
                logger.error("Failed to write report for {} to {}: {}", unit.getFilename(), output, e.getMessage());
            }
        }
        return new UnitReport(unit.getFilename(), output, loops, directives, written, document);
    }
}
