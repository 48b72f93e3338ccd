package io.sunplane.cli;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Maps failures to {@code error: <message>} on stderr and the exit code of their {@link ErrorKind}.
 */
final class CommandFailureHandler implements CommandLine.IExecutionExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandFailureHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        SunException failure = classify(ex);
        log.debug("command {} failed", commandLine.getCommandName(), ex);
        commandLine.getErr().println("error: " + failure.getMessage());
        commandLine.getErr().flush();
        if (jsonRequested(commandLine)) {
            commandLine.getOut().println(Jsons.toJson(new Failure(false, failure.kind().name(), failure.getMessage())));
            commandLine.getOut().flush();
        }
        return failure.kind().exitCode();
    }

    static SunException classify(Throwable error) {
        if (error instanceof SunException sun) {
            return sun;
        }
        if (error instanceof UncheckedIOException || error instanceof IOException) {
            Throwable io = error instanceof UncheckedIOException unchecked ? unchecked.getCause() : error;
            return new SunException(ErrorKind.LOCAL_IO, describe(io), error);
        }
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new SunException(ErrorKind.CANCELLED, "interrupted", error);
        }
        return new SunException(ErrorKind.INTERNAL, describe(error), error);
    }

    private static boolean jsonRequested(CommandLine commandLine) {
        Object root = commandLine.getCommandSpec().root().userObject();
        return root instanceof SunCommand command && command.json;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    record Failure(boolean ok, String kind, String message) {
    }
}
