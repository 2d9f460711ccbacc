/**
 * Composition root for BEACON.
 * <p><strong>Role:</strong> Adapter wiring; the only package that names concrete infrastructure classes.</p>
 */
package ca.gc.cra.beacon.config;
