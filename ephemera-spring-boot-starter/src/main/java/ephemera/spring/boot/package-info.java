/**
 * Spring Boot auto-configuration for ephemeral-content sweeping.
 *
 * <p>Configured under the {@code ephemera.*} prefix. See {@link ephemera.spring.boot.EphemeraProperties}.
 */
package ephemera.spring.boot;
