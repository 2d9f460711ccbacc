/** Process environment adapter. */
package ca.gc.cra.beacon.infrastructure.env;
