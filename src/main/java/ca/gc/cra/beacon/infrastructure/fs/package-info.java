/** File system adapters. */
package ca.gc.cra.beacon.infrastructure.fs;
