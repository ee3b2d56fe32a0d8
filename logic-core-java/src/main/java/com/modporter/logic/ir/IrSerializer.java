package com.modporter.logic.ir;

import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes an IntermediateRepresentation to ir.json.
 * Dependencies are sorted by package name so identical sources produce identical files;
 * the syntax tree keeps source order.
 */
public class IrSerializer {

    public static final String ANALYZER_VERSION = "0.1.0";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code ir} to {@code outputDir/ir.json} and {@code outputDir/metadata.json}.
     *
     * @param ir         analyzer output to write
     * @param outputDir  directory to write into (created if absent)
     * @param sourceName name of the analyzed source unit, recorded in metadata.json
     * @return path of the written ir.json
     */
    public Path write(IrModel.IntermediateRepresentation ir, Path outputDir, String sourceName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        List<IrModel.Dependency> dependencies = new ArrayList<>(ir.dependencies());
        dependencies.sort(Comparator.comparing(IrModel.Dependency::packageName)
                .thenComparing(d -> d.classifier().name()));
        var sorted = new IrModel.IntermediateRepresentation(ir.syntaxTree(), ir.metadata(), dependencies);

        var gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

        Path irPath = outputDir.resolve("ir.json");
        try (Writer w = Files.newBufferedWriter(irPath)) {
            gson.toJson(sorted, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write ir.json: " + e.getMessage(), e);
        }
        System.err.println("[modporter-logic] ir.json written: " + irPath);

        var meta = new Metadata(sourceName, "java", ANALYZER_VERSION, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = Files.newBufferedWriter(metaPath)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        System.err.println("[modporter-logic] metadata.json written: " + metaPath);
        return irPath;
    }

    private record Metadata(
            String sourceName,
            String language,
            String analyzerVersion,
            String timestamp
    ) {}
}
