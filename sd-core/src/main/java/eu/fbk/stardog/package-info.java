/**
 * Client API of the Stardog graph database: {@link eu.fbk.stardog.Stardog} servers,
 * transactional {@link eu.fbk.stardog.Connection}s, query operations and database facades.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.stardog;

