package ca.gc.cra.beacon.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command output: usage text, the resolved configuration and check verdicts.
 *
 * <p>Writes to the native stdout descriptor so logs on stderr never interleave with configuration output that
 * build scripts parse.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> target = new AtomicReference<>(STDOUT);

  private CliPrinter() {}

  static void println(String line) {
    target.get().println(line);
  }

  static void printLines(List<String> lines) {
    PrintWriter out = target.get();
    lines.forEach(out::println);
    out.flush();
  }

  /**
   * Sends command output to {@code sink} until the returned handle is closed.
   *
   * @param sink destination for command output
   * @return handle restoring the previous destination
   */
  static Redirect redirect(Writer sink) {
    PrintWriter previous = target.getAndSet(new PrintWriter(sink, true));
    return () -> target.set(previous);
  }

  /** Restores the previous output destination. */
  interface Redirect extends AutoCloseable {
    @Override
    void close();
  }
}
