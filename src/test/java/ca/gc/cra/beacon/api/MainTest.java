package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private final StringWriter output = new StringWriter();
  private CliPrinter.Redirect redirect;

  @BeforeEach
  void captureOutput() {
    redirect = CliPrinter.redirect(output);
  }

  @AfterEach
  void restoreOutput() {
    redirect.close();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().startsWith("usage: beacon <config|check>"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"build"}));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("check"));
  }

  @Test
  void dispatchesToCheck(@TempDir Path projectDir) {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"CHECK", "dir=" + projectDir}));
    assertTrue(output.toString().contains("origin: default"));
  }
}
