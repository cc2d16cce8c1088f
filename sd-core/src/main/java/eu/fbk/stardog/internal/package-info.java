/**
 * Internal helpers, not part of the public API.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.stardog.internal;

