package com.pdfextract.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import com.pdfextract.backend.entities.ExtractionJob;

/**
 * Keyed storage for extraction jobs. Implementations must make {@link #update} atomic per job and
 * hand out snapshots, never the stored instance.
 */
public interface JobStore {

    /**
     * Stores a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    ExtractionJob create(ExtractionJob job);

    Optional<ExtractionJob> get(String jobId);

    /**
     * Applies {@code mutation} to the stored job under that job's lock.
     *
     * @return a snapshot taken after the mutation, or empty if the job does not exist
     */
    Optional<ExtractionJob> update(String jobId, Consumer<ExtractionJob> mutation);

    Optional<ExtractionJob> delete(String jobId);

    List<String> listIds();
}
