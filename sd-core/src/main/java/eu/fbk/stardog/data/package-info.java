/**
 * Data model: single-use {@link eu.fbk.stardog.data.Stream}s, uploadable
 * {@link eu.fbk.stardog.data.Content} and query requests and results.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.stardog.data;

