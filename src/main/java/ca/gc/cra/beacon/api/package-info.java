/**
 * Command-line entry points for BEACON.
 * <p><strong>Role:</strong> Adapter layer translating {@code key=value} arguments into resolver calls and exit
 * codes.</p>
 * <p><strong>Observability:</strong> Errors are logged through SLF4J; results go to stdout via
 * {@code CliPrinter}.</p>
 */
package ca.gc.cra.beacon.api;
