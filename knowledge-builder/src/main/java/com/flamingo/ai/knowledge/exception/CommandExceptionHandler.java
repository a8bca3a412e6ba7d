package com.flamingo.ai.knowledge.exception;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

/**
 * Turns exceptions escaping a command into a message on stderr and a nonzero exit status.
 *
 * <p>Every failure aborts the run with {@link CommandLine.ExitCode#SOFTWARE}; usage errors never
 * reach this handler because picocli reports them with {@link CommandLine.ExitCode#USAGE}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandExceptionHandler implements CommandLine.IExecutionExceptionHandler {

  private final MeterRegistry meterRegistry;

  @Override
  public int handleExecutionException(
      Exception ex, CommandLine commandLine, ParseResult parseResult) {
    String message;
    if (ex instanceof NoInputDocumentsException e) {
      incrementErrorCounter("no_input_documents");
      log.error("No input documents in {}", e.getDirectory());
      message = e.getUserMessage();
    } else if (ex instanceof ParserUnavailableException e) {
      incrementErrorCounter("parser_unavailable");
      log.error("Document parser unavailable for {}", e.getMediaType());
      message = e.getUserMessage();
    } else if (ex instanceof DocumentProcessingException e) {
      incrementErrorCounter("document_processing");
      log.error("Processing failed for {}: {}", e.getSource(), e.getMessage(), e);
      message = e.getUserMessage() + ": " + e.getMessage();
    } else if (ex instanceof OutputWriteException e) {
      incrementErrorCounter("output_write");
      log.error("Write failed for {}", e.getTarget(), e);
      message = e.getUserMessage() + ": " + e.getMessage();
    } else {
      incrementErrorCounter("unexpected");
      log.error("Unexpected error in {}", commandLine.getCommandName(), ex);
      message = "Unexpected error: " + ex.getMessage();
    }

    commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
    return CommandLine.ExitCode.SOFTWARE;
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("knowledge.errors", "type", errorType).increment();
  }
}
