package com.modporter.logic;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.modporter.logic.config.ConfigReader;
import com.modporter.logic.config.LogicConfig;
import com.modporter.logic.equivalence.EquivalenceValidator;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;
import com.modporter.logic.equivalence.ValidationModel.ValidationVerdict;
import com.modporter.logic.ir.IrModel;
import com.modporter.logic.ir.IrSerializer;
import com.modporter.logic.mapping.ApiMapperService;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.static_analysis.JavaSourceAnalyzer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Command line entry point for the conversion core.
 *
 * Usage:
 *   java -jar logic-core-java.jar analyze  --source <File.java> --output <dir>
 *   java -jar logic-core-java.jar resolve  --signature <java.signature> [--config <modporter.json>]
 *   java -jar logic-core-java.jar validate --original <File.java> --translated <file.js> [--config <modporter.json>]
 */
public class LogicMain {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapter(Instant.class,
                    (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
            .create();

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[modporter-logic] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar logic-core-java.jar analyze|resolve|validate [flags]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[modporter-logic] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("analyze") && !command.equals("resolve") && !command.equals("validate")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        // Parse flags
        String source = null;
        String output = null;
        String signature = null;
        String original = null;
        String translated = null;
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"     -> source     = requireNext(args, i++, "--source");
                case "--output"     -> output     = requireNext(args, i++, "--output");
                case "--signature"  -> signature  = requireNext(args, i++, "--signature");
                case "--original"   -> original   = requireNext(args, i++, "--original");
                case "--translated" -> translated = requireNext(args, i++, "--translated");
                case "--config"     -> configPath = requireNext(args, i++, "--config");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        switch (command) {
            case "analyze" -> {
                if (source == null) throw new UsageException("--source is required");
                if (output == null) throw new UsageException("--output is required");
                analyze(Paths.get(source), Paths.get(output));
            }
            case "resolve" -> {
                if (signature == null) throw new UsageException("--signature is required");
                resolve(signature, loadConfig(configPath), out);
            }
            default -> {
                if (original == null) throw new UsageException("--original is required");
                if (translated == null) throw new UsageException("--translated is required");
                validate(Paths.get(original), Paths.get(translated), loadConfig(configPath), out);
            }
        }
    }

    private static void analyze(Path source, Path output) {
        System.err.println("[modporter-logic] Analyzing: " + source);
        IrModel.IntermediateRepresentation ir = new JavaSourceAnalyzer().analyze(readSource(source));
        System.err.println("[modporter-logic] Analysis complete: "
                + ir.syntaxTree().size() + " top-level nodes, "
                + ir.metadata().methods().size() + " methods, "
                + ir.dependencies().size() + " dependencies");
        new IrSerializer().write(ir, output, source.getFileName().toString());
        System.err.println("[modporter-logic] Done.");
    }

    private static void resolve(String signature, LogicConfig config, PrintStream out) {
        ApiMapperService mapper = ApiMapperService.fromConfig(config);
        if (config.getMappingStore() == null) {
            mapper.initializeDefaults();
        }
        ApiMapping mapping = mapper.resolve(signature);
        out.println(GSON.toJson(mapping));
    }

    private static void validate(Path original, Path translated, LogicConfig config, PrintStream out) {
        System.err.println("[modporter-logic] Validating " + translated + " against " + original);
        try (EquivalenceValidator validator = EquivalenceValidator.fromConfig(config)) {
            ValidationVerdict verdict = validator.validate(
                    readSource(original), readSource(translated), TranslationContext.defaults());
            System.err.println("[modporter-logic] Verdict: equivalent=" + verdict.isEquivalent()
                    + ", confidence=" + String.format("%.2f", verdict.confidence()));
            out.println(GSON.toJson(verdict));
        }
    }

    private static LogicConfig loadConfig(String configPath) {
        if (configPath == null) return LogicConfig.defaults();
        System.err.println("[modporter-logic] Reading config: " + configPath);
        return new ConfigReader().read(Paths.get(configPath));
    }

    private static String readSource(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
