/**
 * Core domain model for SEDFUSE catalog fusion.
 * <p><strong>Role:</strong> Sky positions, sources, measurements, photometric band tables, and the extinction
 * and cosmology calculations, without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@link org.sedfuse.domain.sed.Source} is
 * confined to the pipeline processing it.</p>
 * <p><strong>Metrics:</strong> Data sources feed tagging on {@code sed.catalog.*} metrics.</p>
 */
package org.sedfuse.domain;
