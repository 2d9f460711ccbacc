/**
 * Argument validation helpers for the CLI layer.
 * <p><strong>Role:</strong> Domain support utilities; throw {@link java.lang.IllegalArgumentException} on bad input.</p>
 */
package ca.gc.cra.beacon.validation;
