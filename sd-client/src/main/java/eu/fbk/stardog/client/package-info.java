/**
 * HTTP client for remote Stardog servers, based on Jersey and Apache HttpClient.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.stardog.client;

