/**
 * Catalog normalizers: each turns one catalog response into measurements or resolved fields on a source.
 * <p><strong>Error handling:</strong> Normalizers never throw on missing columns or empty responses; they report a
 * soft failure through {@link org.sedfuse.application.normalize.NormalizationResult}.</p>
 *
 * @since 0.1.0
 */
package org.sedfuse.application.normalize;
