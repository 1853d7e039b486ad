package com.pdfextract.backend.repositories;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.springframework.stereotype.Repository;

import com.pdfextract.backend.entities.ExtractionJob;

/**
 * Process-lifetime job store. Each job is guarded by its own monitor, so concurrent jobs never contend.
 */
@Repository
public class InMemoryJobStore implements JobStore {

    private final Map<String, ExtractionJob> jobs = new ConcurrentHashMap<>();

    @Override
    public ExtractionJob create(ExtractionJob job) {
        if (job == null || job.getId() == null) {
            throw new IllegalArgumentException("job id is required");
        }
        ExtractionJob stored = job.copy();
        if (jobs.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("Job already exists: " + stored.getId());
        }
        synchronized (stored) {
            return stored.copy();
        }
    }

    @Override
    public Optional<ExtractionJob> get(String jobId) {
        ExtractionJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) return Optional.empty();
        synchronized (job) {
            return Optional.of(job.copy());
        }
    }

    @Override
    public Optional<ExtractionJob> update(String jobId, Consumer<ExtractionJob> mutation) {
        ExtractionJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) return Optional.empty();
        synchronized (job) {
            mutation.accept(job);
            return Optional.of(job.copy());
        }
    }

    @Override
    public Optional<ExtractionJob> delete(String jobId) {
        ExtractionJob removed = jobId == null ? null : jobs.remove(jobId);
        if (removed == null) return Optional.empty();
        synchronized (removed) {
            return Optional.of(removed.copy());
        }
    }

    @Override
    public List<String> listIds() {
        return List.copyOf(jobs.keySet());
    }
}
