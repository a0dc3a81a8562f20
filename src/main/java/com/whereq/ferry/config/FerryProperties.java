package com.whereq.ferry.config;

import com.whereq.ferry.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Ferry.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "ferry")
@Data
public class FerryProperties {

    /**
     * Google Cloud project. Falls back to GOOGLE_CLOUD_PROJECT.
     */
    private String project;

    /**
     * Instance regions (or region prefixes) machines may be scheduled in.
     */
    private List<String> regions = new ArrayList<>(List.of("us-east1", "us-west1", "us-central1"));

    /**
     * Life Sciences location or location prefix, e.g. us-central1 or europe.
     * Derived from the regions when unset.
     */
    private String location;

    private ApiConfig api = new ApiConfig();

    private CredentialsConfig credentials = new CredentialsConfig();

    private StorageConfig storage = new StorageConfig();

    private SourceConfig source = new SourceConfig();

    private MachineConfig machine = new MachineConfig();

    private ContainerConfig container = new ContainerConfig();

    private RetryConfig retry = new RetryConfig();

    private StatusConfig status = new StatusConfig();

    private PreemptibleConfig preemptible = new PreemptibleConfig();

    @Data
    public static class ApiConfig {
        private String lifeSciencesUrl = "https://lifesciences.googleapis.com/v2beta";

        private String computeUrl = "https://compute.googleapis.com/compute/v1";

        private String storageUrl = "https://storage.googleapis.com";

        /**
         * Timeout of a single HTTP exchange.
         */
        private long timeoutMs = 60000;
    }

    @Data
    public static class CredentialsConfig {
        /**
         * OAuth2 access token. Falls back to GOOGLE_OAUTH_ACCESS_TOKEN.
         */
        private String accessToken;
    }

    @Data
    public static class StorageConfig {
        private static final String LOGS_DIRECTORY = "google-lifesciences-logs";

        /**
         * bucket/subdirectory used for logs and the source cache.
         */
        private String remotePrefix;

        /**
         * Keep uploaded source packages after shutdown.
         */
        private boolean keepSourceCache = false;

        /**
         * Object prefix the source packages are uploaded under.
         */
        private String cachePrefix = "source/cache";

        /**
         * First segment of the remote prefix
         */
        public String bucketName() {
            if (remotePrefix == null || remotePrefix.isBlank()) {
                throw new ConfigurationException("ferry.storage.remote-prefix must be set to bucket[/subdirectory]");
            }
            return remotePrefix.split("/")[0];
        }

        /**
         * Remote prefix without the bucket, empty when the prefix is just a bucket
         */
        public String subdirectory() {
            String bucket = bucketName();
            return remotePrefix.length() > bucket.length() + 1 ? remotePrefix.substring(bucket.length() + 1) : "";
        }

        /**
         * Object prefix the pipeline logs are saved under
         */
        public String logsPrefix() {
            String subdirectory = subdirectory();
            return subdirectory.isEmpty() ? LOGS_DIRECTORY : subdirectory + "/" + LOGS_DIRECTORY;
        }
    }

    @Data
    public static class SourceConfig {
        /**
         * Root of the archive; every source must live below it.
         */
        private String workdir = ".";

        /**
         * Files or directories to package. Defaults to the whole working directory.
         */
        private List<String> paths = new ArrayList<>();

        /**
         * Entry file of the workflow, always packaged when set.
         */
        private String mainFile;

        /**
         * Local directory holding the content addressed archives.
         */
        private String cacheDir = ".ferry/cache";

        /**
         * Files above this size only produce a warning.
         */
        private double sizeWarningGb = 0.2;
    }

    @Data
    public static class MachineConfig {
        private String serviceAccountEmail;

        private String network;

        private String subnetwork;
    }

    @Data
    public static class ContainerConfig {
        /**
         * Image used for both the job and the log action.
         */
        private String image = "snakemake/snakemake:stable";

        /**
         * Workflow runs software inside Singularity.
         */
        private boolean useSingularity = false;

        /**
         * Helper that downloads the package and saves logs inside the container.
         */
        private String helperScriptUrl =
            "https://raw.githubusercontent.com/snakemake/snakemake-executor-plugin-google-lifesciences/main/"
                + "snakemake_executor_plugin_google_lifesciences/google_lifesciences_helper.py";

        /**
         * Environment activation; allowed to fail for custom images.
         */
        private String activateCommand = "source activate snakemake || true";

        /**
         * Host variables copied into every job's environment.
         */
        private List<String> envVars = new ArrayList<>();
    }

    @Data
    public static class RetryConfig {
        /**
         * Total executions of a remote call, the first one included.
         */
        private int maxAttempts = 4;

        /**
         * Sleep before the first retry, doubled afterwards.
         */
        private long initialDelayMs = 2000;
    }

    @Data
    public static class StatusConfig {
        /**
         * Upper bound on operations.get calls per second across all pollers.
         */
        private double queriesPerSecond = 10.0;

        /**
         * Delay between two polling sweeps.
         */
        private long pollIntervalMs = 10000;
    }

    @Data
    public static class PreemptibleConfig {
        /**
         * Every rule may run on preemptible instances.
         */
        private boolean all = false;

        /**
         * Rules allowed to run on preemptible instances.
         */
        private List<String> rules = new ArrayList<>();
    }
}
