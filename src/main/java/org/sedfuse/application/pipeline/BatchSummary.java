package org.sedfuse.application.pipeline;

/**
 * Counters reported at the end of a fusion batch.
 *
 * @param linesRead input lines read, including blanks and comments
 * @param linesSkipped lines that did not parse or could not form a source
 * @param sourcesProcessed sources whose results were written
 * @param sourcesFailed sources aborted by an unexpected error
 * @param measurementsWritten result lines written
 * @since 0.1.0
 */
public record BatchSummary(
    long linesRead, long linesSkipped, long sourcesProcessed, long sourcesFailed, long measurementsWritten) {}
