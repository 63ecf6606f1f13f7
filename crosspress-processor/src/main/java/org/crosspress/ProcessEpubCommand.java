package org.crosspress;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crosspress.exception.EpubProcessingException;
import org.crosspress.service.EpubProcessingService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Command-line entry: {@code <input.epub> <output.epub>}. Exits 0 on success, 1 on a usage
 * error or an unexpected failure, and the error's own exit code on a fatal processing failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessEpubCommand implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 1;
    static final String USAGE = "Usage: crosspress-processor <input.epub> <output.epub>";

    // --name=value is a Spring property override; anything else is a path, even if it starts with "--"
    private static final Pattern PROPERTY_OVERRIDE = Pattern.compile("--[^=\\s]+=.*");

    private final EpubProcessingService epubProcessingService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        List<String> positional = Arrays.stream(args)
                .filter(arg -> !PROPERTY_OVERRIDE.matcher(arg).matches())
                .toList();
        if (positional.size() != 2) {
            System.err.println(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            epubProcessingService.process(Path.of(positional.get(0)), Path.of(positional.get(1)));
            exitCode = EXIT_OK;
        } catch (EpubProcessingException e) {
            reportFatal(e.getMessage(), e);
            exitCode = e.getExitCode();
        } catch (RuntimeException e) {
            reportFatal(e.toString(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    private static void reportFatal(String message, RuntimeException e) {
        System.err.println("FATAL ERROR: " + message);
        log.error("FATAL ERROR: {}", message);
        log.debug("Failure detail", e);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
