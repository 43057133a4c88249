package com.csd.packagefinder.cli;

import com.csd.packagefinder.exception.InvalidSearchRequestException;
import com.csd.packagefinder.model.ExportFormat;
import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.service.ExportService;
import com.csd.packagefinder.service.PackageSearcher;
import com.csd.packagefinder.service.SearchResultFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code package-finder [--format=text|json|csv] NAME...}
 * <p>
 * Exit codes: 0 after a completed search (found or not), 2 on a usage error, 1 when output
 * could not be written.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "packagefinder.cli.enabled", havingValue = "true")
public class SearchCommand implements CommandLineRunner, ExitCodeGenerator {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_LINE = "usage: package-finder [--format=text|json|csv] NAME...";

    private final PackageSearcher searcher;
    private final SearchResultFormatter formatter;
    private final ExportService exportService;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = OK;

    public SearchCommand(PackageSearcher searcher, SearchResultFormatter formatter, ExportService exportService) {
        this(searcher, formatter, exportService, System.out, System.err);
    }

    SearchCommand(PackageSearcher searcher, SearchResultFormatter formatter, ExportService exportService,
                  PrintStream out, PrintStream err) {
        this.searcher = searcher;
        this.formatter = formatter;
        this.exportService = exportService;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) {
        Invocation invocation;
        try {
            invocation = parse(args);
        } catch (InvalidSearchRequestException e) {
            err.println(formatter.formatError(e.getMessage()));
            err.println(USAGE_LINE);
            return USAGE;
        }
        if (invocation == null) {
            out.println(USAGE_LINE);
            return OK;
        }

        Map<String, SearchResult> results;
        try {
            results = searcher.searchPackages(invocation.names);
        } catch (InvalidSearchRequestException e) {
            err.println(formatter.formatError(e.getMessage()));
            err.println(USAGE_LINE);
            return USAGE;
        }

        try {
            switch (invocation.format) {
                case JSON:
                    out.println(exportService.exportJson(results));
                    break;
                case CSV:
                    out.print(exportService.exportCsv(results));
                    break;
                default:
                    out.print(formatter.formatAll(results));
                    break;
            }
        } catch (IOException e) {
            log.error("Could not write {} output", invocation.format, e);
            err.println(formatter.formatError("Could not write output: " + e.getMessage()));
            return FAILED;
        }
        out.flush();
        return OK;
    }

    /**
     * @return the parsed invocation, or null when help was asked for
     */
    static Invocation parse(String... args) {
        ExportFormat format = ExportFormat.TEXT;
        List<String> names = new ArrayList<>();
        boolean optionsDone = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsDone || !arg.startsWith("-")) {
                names.add(arg);
            } else if (arg.equals("--")) {
                optionsDone = true;
            } else if (arg.equals("-h") || arg.equals("--help")) {
                return null;
            } else if (arg.startsWith("--format=")) {
                format = outputFormat(arg.substring("--format=".length()));
            } else if (arg.equals("--format")) {
                if (i + 1 >= args.length) {
                    throw new InvalidSearchRequestException("--format needs a value");
                }
                format = outputFormat(args[++i]);
            } else if (!isPropertyOverride(arg)) {
                throw new InvalidSearchRequestException("Unknown option: " + arg);
            }
        }
        if (names.isEmpty()) {
            throw new InvalidSearchRequestException("At least one package name is required");
        }
        return new Invocation(format, names);
    }

    // --spring.*, --logging.* and --packagefinder.* are applied by Spring Boot before we run
    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--spring.") || arg.startsWith("--logging.") || arg.startsWith("--packagefinder.");
    }

    private static ExportFormat outputFormat(String value) {
        ExportFormat format = ExportFormat.parse(value);
        if (format == ExportFormat.XLSX) {
            throw new InvalidSearchRequestException("xlsx output is only available from the REST API");
        }
        return format;
    }

    static final class Invocation {
        final ExportFormat format;
        final List<String> names;

        Invocation(ExportFormat format, List<String> names) {
            this.format = format;
            this.names = names;
        }
    }
}
