package com.repograph.cli;

import com.repograph.core.export.GraphExporter;
import com.repograph.core.model.Language;
import com.repograph.core.model.LanguageFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list supported languages or available exporters.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * repograph list languages
 * repograph list exporters
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages or available exporters",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: languages or exporters"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language" -> listLanguages();
            case "exporters", "exporter", "formats" -> listExporters();
            default -> {
                log.error("Unknown type: {}. Use: languages or exporters", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: languages or exporters");
                yield 1;
            }
        };
    }

    private int listLanguages() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Supported Languages:");
        out.println();
        for (LanguageFamily family : LanguageFamily.values()) {
            if (family == LanguageFamily.NONE) {
                continue;
            }
            out.printf("  • %s%n", family.id());
            for (Language language : Language.values()) {
                if (language.family() == family) {
                    out.printf("    %s (.%s)%n", language.displayName(), String.join(", .", new TreeSet<>(language.extensions())));
                }
            }
        }
        out.flush();
        return 0;
    }

    private int listExporters() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Exporters:");
        out.println();

        boolean found = false;
        for (GraphExporter exporter : ServiceLoader.load(GraphExporter.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", exporter.getDisplayName(), exporter.getId());
            out.printf("    File Extension: .%s%n", exporter.getFileExtension());
            out.println();
        }

        if (!found) {
            out.println("  No exporters found.");
        }
        out.flush();
        return 0;
    }
}
