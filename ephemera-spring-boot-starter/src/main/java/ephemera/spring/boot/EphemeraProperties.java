package ephemera.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for ephemeral-content sweeping.
 *
 * @see EphemeraAutoConfiguration
 */
@ConfigurationProperties(prefix = "ephemera")
public class EphemeraProperties {

    private final Tables tables = new Tables();
    private final Sweep sweep = new Sweep();
    private final Blob blob = new Blob();
    private final Metrics metrics = new Metrics();
    private final Endpoint endpoint = new Endpoint();

    public Tables getTables() {
        return tables;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Blob getBlob() {
        return blob;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public static class Tables {
        /**
         * Content item table.
         */
        private String content = "content_item";

        /**
         * Like edge table.
         */
        private String likes = "content_like";

        /**
         * Comment edge table.
         */
        private String comments = "content_comment";

        /**
         * Column in both edge tables that references the content item id.
         */
        private String parentColumn = "item_id";

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }

        public String getLikes() {
            return likes;
        }

        public void setLikes(String likes) {
            this.likes = likes;
        }

        public String getComments() {
            return comments;
        }

        public void setComments(String comments) {
            this.comments = comments;
        }

        public String getParentColumn() {
            return parentColumn;
        }

        public void setParentColumn(String parentColumn) {
            this.parentColumn = parentColumn;
        }
    }

    public static class Sweep {
        /**
         * Whether sweeps run on a schedule. The trigger endpoint works either way.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one sweep and the start of the next.
         */
        private Duration interval = Duration.ofMinutes(5);

        /**
         * Delay before the first scheduled sweep. Defaults to the interval.
         */
        private Duration initialDelay;

        /**
         * Maximum expired items processed per sweep.
         */
        private int batchSize = 1000;

        /**
         * Items processed concurrently; 1 processes them one after another.
         */
        private int workerCount = 1;

        /**
         * Maximum time one item's cleanup may take. Unbounded when unset.
         */
        private Duration itemTimeout;

        /**
         * Whether each sweep also removes likes and comments whose item no longer exists.
         */
        private boolean reconcileOrphans = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getItemTimeout() {
            return itemTimeout;
        }

        public void setItemTimeout(Duration itemTimeout) {
            this.itemTimeout = itemTimeout;
        }

        public boolean isReconcileOrphans() {
            return reconcileOrphans;
        }

        public void setReconcileOrphans(boolean reconcileOrphans) {
            this.reconcileOrphans = reconcileOrphans;
        }
    }

    public static class Blob {
        /**
         * Object API root, e.g. https://PROJECT.supabase.co/storage/v1/object. Blob deletion
         * fails with a recorded error when unset.
         */
        private String endpoint;

        /**
         * Bucket holding media blobs; also the URL segment preceding the blob path.
         */
        private String bucket = "audio";

        /**
         * Service key sent as bearer token and apikey header.
         */
        private String serviceKey;

        /**
         * Timeout of one delete request.
         */
        private Duration requestTimeout = Duration.ofSeconds(10);

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getServiceKey() {
            return serviceKey;
        }

        public void setServiceKey(String serviceKey) {
            this.serviceKey = serviceKey;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Metrics {
        /**
         * Whether to export sweep metrics to Micrometer when it is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "ephemera";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Endpoint {
        /**
         * Whether to expose the HTTP sweep trigger in servlet web applications.
         */
        private boolean enabled = true;

        /**
         * Path of the sweep trigger (POST).
         */
        private String path = "/internal/sweeps";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
