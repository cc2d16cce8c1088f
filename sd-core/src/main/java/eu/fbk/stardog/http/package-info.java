/**
 * Transport contract between a {@code Connection} and the HTTP layer: {@link Request},
 * {@link Response} and the {@link Transport} that exchanges them.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.stardog.http;

