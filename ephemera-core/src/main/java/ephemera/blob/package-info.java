/**
 * {@link ephemera.spi.BlobStore} implementations.
 */
package ephemera.blob;
