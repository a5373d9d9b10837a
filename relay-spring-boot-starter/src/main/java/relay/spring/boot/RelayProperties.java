package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Accounts this process may run. Unset runs every enabled account; an empty list runs
     * none.
     */
    private List<String> accounts;

    /**
     * Interval between reconciliation passes. Zero disables periodic refresh.
     */
    private Duration refreshInterval = Duration.ofSeconds(3);

    /**
     * How long an account tailer sleeps after an empty or failed query.
     */
    private Duration pollDelay = Duration.ofMillis(100);

    /**
     * Upper bound on one blocking handoff attempt between threads.
     */
    private Duration handoffTimeout = Duration.ofMillis(50);

    private int batchSize = 100;

    /**
     * Nick used for accounts whose nick is blank.
     */
    private String defaultNick = "relay";

    private final Directory directory = new Directory();
    private final Metrics metrics = new Metrics();

    public List<String> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<String> accounts) {
        this.accounts = accounts;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public Duration getPollDelay() {
        return pollDelay;
    }

    public void setPollDelay(Duration pollDelay) {
        this.pollDelay = pollDelay;
    }

    public Duration getHandoffTimeout() {
        return handoffTimeout;
    }

    public void setHandoffTimeout(Duration handoffTimeout) {
        this.handoffTimeout = handoffTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getDefaultNick() {
        return defaultNick;
    }

    public void setDefaultNick(String defaultNick) {
        this.defaultNick = defaultNick;
    }

    public Directory getDirectory() {
        return directory;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Directory server reached through a connection broker. The broker is only created
     * when {@code url} is set.
     */
    public static class Directory {
        private String url;
        private String baseDn;
        private String bindDn;
        private String bindPassword;
        private Duration requestTimeout = Duration.ofSeconds(5);
        private Duration redialDelay = Duration.ofSeconds(5);
        private Duration pingInterval = Duration.ofSeconds(5);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getBaseDn() {
            return baseDn;
        }

        public void setBaseDn(String baseDn) {
            this.baseDn = baseDn;
        }

        public String getBindDn() {
            return bindDn;
        }

        public void setBindDn(String bindDn) {
            this.bindDn = bindDn;
        }

        public String getBindPassword() {
            return bindPassword;
        }

        public void setBindPassword(String bindPassword) {
            this.bindPassword = bindPassword;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public Duration getRedialDelay() {
            return redialDelay;
        }

        public void setRedialDelay(Duration redialDelay) {
            this.redialDelay = redialDelay;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

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
