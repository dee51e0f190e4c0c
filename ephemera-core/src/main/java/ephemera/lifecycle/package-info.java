/**
 * Creation-time classification, TTL assignment and expiration checks.
 */
package ephemera.lifecycle;
