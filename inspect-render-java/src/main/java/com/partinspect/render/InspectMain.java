package com.partinspect.render;

import com.partinspect.engine.InspectionManager;
import com.partinspect.engine.context.TreeContextSerializer;
import com.partinspect.render.config.RenderConfig;
import com.partinspect.render.config.RenderConfigReader;
import com.partinspect.render.input.JsonDocumentReader;
import com.partinspect.render.style.StyleRegistry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line inspection of a JSON document.
 *
 * Usage:
 *   java -jar inspect-render-java.jar inspect \
 *     --input  <document.json> \
 *     [--config <settings.json>] [--name <root>] [--depth <n>] [--items <n>] \
 *     [--style text|html|context] [--output <file>]
 *
 * Flags override the settings file; the settings file overrides built-in defaults.
 */
public class InspectMain {

    public static void main(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (UsageException e) {
            System.err.println("[part-inspect] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar inspect-render-java.jar inspect --input <file> "
                + "[--config <file>] [--name <root>] [--depth <n>] [--items <n>] [--style <name>] [--output <file>]");
            System.exit(2);
            return;
        }
        try {
            String rendered = execute(options);
            if (options.output() == null) {
                System.out.println(rendered);
            }
            System.exit(0);
        } catch (Exception e) {
            System.err.println("[part-inspect] FATAL: " + e.getMessage());
            if ("context".equalsIgnoreCase(options.style())) {
                System.out.println(new TreeContextSerializer().errorRecord(e.getMessage()));
            }
            System.exit(1);
        }
    }

    /** Parses and runs in one step. Returns the rendered text. */
    static String run(String[] args) {
        return execute(parse(args));
    }

    record Options(
        Path input,
        Path config,
        String name,
        Integer depth,
        Integer items,
        String style,
        Path output
    ) {}

    static Options parse(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("inspect")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String input = null;
        String config = null;
        String name = null;
        Integer depth = null;
        Integer items = null;
        String style = null;
        String output = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> input  = requireNext(args, i++, "--input");
                case "--config" -> config = requireNext(args, i++, "--config");
                case "--name"   -> name   = requireNext(args, i++, "--name");
                case "--depth"  -> depth  = requireCount(args, i++, "--depth");
                case "--items"  -> items  = requireCount(args, i++, "--items");
                case "--style"  -> style  = requireNext(args, i++, "--style");
                case "--output" -> output = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (input == null) throw new UsageException("--input is required");

        return new Options(
            Paths.get(input),
            config != null ? Paths.get(config) : null,
            name, depth, items, style,
            output != null ? Paths.get(output) : null);
    }

    static String execute(Options options) {
        // 1. Settings
        RenderConfig settings = RenderConfig.defaults();
        if (options.config() != null) {
            System.err.println("[part-inspect] Reading config: " + options.config());
            settings = new RenderConfigReader().read(options.config());
        }
        String rootName = options.name() != null ? options.name() : settings.getRootName();
        String styleName = options.style() != null ? options.style() : settings.getStyle();
        int depth = options.depth() != null ? options.depth() : settings.getMaxDepth();
        int items = options.items() != null ? options.items() : settings.getMaxItems();

        InspectionManager manager = new InspectionManager(settings.toInspectConfig().withBudgets(depth, items));
        InspectionRenderer renderer = new InspectionRenderer(manager, StyleRegistry.withDefaults());

        // 2. Document
        System.err.println("[part-inspect] Reading document: " + options.input());
        Object document = new JsonDocumentReader().read(options.input());

        // 3. Inspect and render
        System.err.println("[part-inspect] Inspecting '" + rootName + "' depth=" + depth
            + " items=" + items + " style=" + styleName);
        String rendered = renderer.render(rootName, document, styleName);

        // 4. Output
        if (options.output() != null) {
            write(options.output(), rendered);
            System.err.println("[part-inspect] Output written: " + options.output());
        }
        return rendered;
    }

    private static void write(Path output, String rendered) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputException("Failed to write " + output + ": " + e.getMessage(), e);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int requireCount(String[] args, int i, String flag) {
        String raw = requireNext(args, i, flag);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) throw new UsageException(flag + " must be >= 0, was " + value);
            return value;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got: " + raw);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }

    static class OutputException extends RuntimeException {
        OutputException(String msg, Throwable cause) { super(msg, cause); }
    }
}
