package changefeed.spring.boot;

import changefeed.announce.BurstWindow;
import changefeed.resync.FullRunMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the change feed engine.
 *
 * @see ChangeFeedAutoConfiguration
 */
@ConfigurationProperties(prefix = "changefeed")
public class ChangeFeedProperties {

    /**
     * Full resync mode. {@code NONE} polls the change feed.
     */
    private FullRunMode fullRun = FullRunMode.NONE;

    /**
     * Whether the product-info store can be queried. When false the poller polls without pausing.
     */
    private boolean storeQueryEnabled = true;

    /**
     * Starts polling (or the full run) as soon as the context is up.
     */
    private boolean autoStart = true;

    /**
     * File holding the last processed change number.
     */
    private String stateFile = "last-changenumber.txt";

    private long statusIntervalMs = 10000;

    private final Poller poller = new Poller();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Important important = new Important();
    private final Links links = new Links();
    private final Burst burst = new Burst();
    private final Metrics metrics = new Metrics();

    public FullRunMode getFullRun() {
        return fullRun;
    }

    public void setFullRun(FullRunMode fullRun) {
        this.fullRun = fullRun;
    }

    public boolean isStoreQueryEnabled() {
        return storeQueryEnabled;
    }

    public void setStoreQueryEnabled(boolean storeQueryEnabled) {
        this.storeQueryEnabled = storeQueryEnabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public long getStatusIntervalMs() {
        return statusIntervalMs;
    }

    public void setStatusIntervalMs(long statusIntervalMs) {
        this.statusIntervalMs = statusIntervalMs;
    }

    public Poller getPoller() {
        return poller;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Important getImportant() {
        return important;
    }

    public Links getLinks() {
        return links;
    }

    public Burst getBurst() {
        return burst;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Poller {
        private long intervalMs = 10000;
        private long requestTimeoutMs = 30000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private long drainTimeoutMs = 5000;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    /**
     * Apps and packages whose updates are announced to their dedicated channels.
     */
    public static class Important {
        private List<Integer> apps = new ArrayList<>();
        private List<Integer> packages = new ArrayList<>();

        public List<Integer> getApps() {
            return apps;
        }

        public void setApps(List<Integer> apps) {
            this.apps = apps;
        }

        public List<Integer> getPackages() {
            return packages;
        }

        public void setPackages(List<Integer> packages) {
            this.packages = packages;
        }
    }

    public static class Links {
        private String baseUrl = changefeed.announce.Links.DEFAULT_BASE_URL;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Burst {
        private int threshold = BurstWindow.DEFAULT_THRESHOLD;
        private Duration window = BurstWindow.DEFAULT_LENGTH;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "changefeed";

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
}
