package com.bridgesentinel.pipeline;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.config.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Shared start-up and failure handling for the job entry points.
 *
 * <p>
 * Every job resolves {@link JobSettings}, loads the {@link PipelineConfig},
 * installs a {@link ShutdownSignal} hook and runs its body. Any exception
 * escaping the body is fatal: it is logged and the process exits with
 * status 1.
 * </p>
 *
 * @since 1.0.0
 */
final class JobSupport {

    private static final Logger LOG = LoggerFactory.getLogger(JobSupport.class);

    /** How long the shutdown hook waits for the current unit of work. */
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private JobSupport() {
        // utility class, not instantiable
    }

    /**
     * Body of a job.
     */
    @FunctionalInterface
    interface Job {
        void run(JobSettings settings, PipelineConfig config, ShutdownSignal signal);
    }

    /**
     * Run a job body and translate failure into an exit status.
     *
     * @return 0 on success, 1 on a fatal error
     */
    static int run(String name, String[] args, Job job) {
        ShutdownSignal signal = new ShutdownSignal();
        try {
            JobSettings settings = JobSettings.fromEnvironment(args);
            LOG.info("Starting {} job with settings: {}", name, settings);
            PipelineConfig config = loadPipelineConfig(settings);
            signal.installShutdownHook(SHUTDOWN_GRACE);
            job.run(settings, config, signal);
            LOG.info("{} job finished", name);
            return 0;
        } catch (RuntimeException e) {
            LOG.error("{} job failed: {}", name, e.getMessage(), e);
            return 1;
        } finally {
            signal.markFinished();
        }
    }

    static PipelineConfig loadPipelineConfig(JobSettings settings) {
        String path = settings.getPipelineConfigPath();
        if (path != null && !path.isBlank()) {
            return PipelineConfigLoader.fromFile(path);
        }
        return PipelineConfigLoader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);
    }

    static void exit(int status) {
        if (status != 0) {
            System.exit(status);
        }
    }
}
