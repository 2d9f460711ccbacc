/**
 * SnakeYAML loading of {@code beacon.config.yaml}, including the {@code !hook} tag for factories and build id
 * generators.
 */
package ca.gc.cra.beacon.infrastructure.yaml;
