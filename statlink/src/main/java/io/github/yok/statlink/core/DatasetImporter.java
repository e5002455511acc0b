package io.github.yok.statlink.core;

import io.github.yok.statlink.config.LoaderConfig;
import io.github.yok.statlink.config.PathsConfig;
import io.github.yok.statlink.dataset.MeltedTable;
import io.github.yok.statlink.dataset.RenamedColumnsTable;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.parser.DatasetReaderFactory;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.util.ErrorHandler;
import io.github.yok.statlink.util.LogPathUtil;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.ITable;

/**
 * Runs configured import jobs: read a dataset file, reshape it, load it into an entity type and
 * apply it to the versioned store.
 *
 * <p>
 * Each job runs in its own {@link UnitOfWork} and is committed on success. A failing job is
 * reported through {@link ErrorHandler} and rolled back; the remaining jobs still run and jobs
 * committed earlier stay committed. A summary of all jobs is logged at the end.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DatasetImporter {

    private final ConnectionManager connectionManager;

    private final LoaderConfig loaderConfig;

    private final PathsConfig pathsConfig;

    private final BulkLoader bulkLoader;

    /**
     * Runs the selected configured jobs.
     *
     * @param jobNames names of jobs to run; {@code null} or empty runs every configured job
     * @return per-job results in execution order
     */
    public List<JobResult> execute(List<String> jobNames) {
        List<LoaderConfig.Job> jobs = selectJobs(jobNames);
        log.info("=== DatasetImporter started (jobs={}) ===",
                jobs.stream().map(LoaderConfig.Job::getDisplayName).collect(Collectors.toList()));
        List<JobResult> results = new ArrayList<>();
        for (LoaderConfig.Job job : jobs) {
            results.add(runJob(job));
        }
        log.info("=== DatasetImporter finished ===");
        logSummary(results);
        return results;
    }

    /**
     * Runs a single job that is not part of the configuration.
     *
     * @param entity entity name
     * @param file dataset file, absolute or relative to the datasets directory
     * @return job result
     */
    public JobResult executeAdHoc(String entity, String file) {
        LoaderConfig.Job job = new LoaderConfig.Job();
        job.setName(entity);
        job.setEntity(entity);
        job.setFile(file);
        JobResult result = runJob(job);
        logSummary(Collections.singletonList(result));
        return result;
    }

    private List<LoaderConfig.Job> selectJobs(List<String> jobNames) {
        List<LoaderConfig.Job> configured = loaderConfig.getJobs();
        if (jobNames == null || jobNames.isEmpty()) {
            return configured;
        }
        Set<String> wanted = new LinkedHashSet<>(jobNames);
        List<LoaderConfig.Job> selected = configured.stream()
                .filter(j -> wanted.contains(j.getDisplayName())).collect(Collectors.toList());
        selected.forEach(j -> wanted.remove(j.getDisplayName()));
        if (!wanted.isEmpty()) {
            log.warn("Unknown jobs ignored: {}", wanted);
        }
        return selected;
    }

    private JobResult runJob(LoaderConfig.Job job) {
        String name = job.getDisplayName();
        try {
            Path file = resolveFile(job.getFile());
            log.info("[{}] Reading {}", name, LogPathUtil.renderPathForLog(file));
            ITable table = reshape(job, DatasetReaderFactory.read(file.toFile(), job.getFormat(),
                    job.getDelimiter(), job.getNullValues()));

            ApplyResult applied = connectionManager.inUnitOfWork(uow -> {
                EntityType type = uow.openEntityType(job.getEntity());
                List<EntityRecord> candidates = bulkLoader.load(type, table);
                return uow.apply(type, candidates);
            });
            log.info("[{}] Committed: inserted={}, expired={}, duplicates={}", name,
                    applied.getInsertedCount(), applied.getExpiredCount(),
                    applied.getDuplicateCount());
            return JobResult.succeeded(name, applied);
        } catch (Exception e) {
            ErrorHandler.errorAndExit("[" + name + "] Import failed", e);
            return JobResult.failed(name, e.getMessage());
        }
    }

    private Path resolveFile(String file) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("Dataset file is not configured.");
        }
        Path path = Paths.get(file);
        if (path.isAbsolute()) {
            return path;
        }
        return Paths.get(pathsConfig.getDatasets()).resolve(path);
    }

    private ITable reshape(LoaderConfig.Job job, ITable table) throws Exception {
        ITable result = table;
        if (job.getColumnMapping() != null && !job.getColumnMapping().isEmpty()) {
            result = new RenamedColumnsTable(result, job.getColumnMapping());
        }
        LoaderConfig.Melt melt = job.getMelt();
        if (melt != null && melt.getIdColumns() != null && !melt.getIdColumns().isEmpty()) {
            result = new MeltedTable(result, melt.getIdColumns(), melt.getVariableColumn(),
                    melt.getValueColumn());
        }
        return result;
    }

    private void logSummary(List<JobResult> results) {
        log.info("===== Summary =====");
        int maxNameLen = results.stream().mapToInt(r -> r.getJob().length()).max().orElse(0);
        String fmt = "  Job[%-" + Math.max(maxNameLen, 1)
                + "s] %-6s inserted=%d, expired=%d, duplicates=%d";
        for (JobResult r : results) {
            log.info(String.format(fmt, r.getJob(), r.isSucceeded() ? "OK" : "FAILED",
                    r.getInserted(), r.getExpired(), r.getDuplicates()));
        }
    }

    /**
     * Outcome of one job.
     */
    @Value
    public static class JobResult {
        String job;
        boolean succeeded;
        int inserted;
        int expired;
        int duplicates;
        // Failure message; null on success
        String message;

        static JobResult succeeded(String job, ApplyResult result) {
            return new JobResult(job, true, result.getInsertedCount(), result.getExpiredCount(),
                    result.getDuplicateCount(), null);
        }

        static JobResult failed(String job, String message) {
            return new JobResult(job, false, 0, 0, 0, message);
        }
    }
}
