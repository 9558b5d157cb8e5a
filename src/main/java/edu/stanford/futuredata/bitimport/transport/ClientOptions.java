package edu.stanford.futuredata.bitimport.transport;

public class ClientOptions {

    public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 30000;
    public static final int DEFAULT_REQUEST_TIMEOUT_MILLIS = 300000;
    public static final int DEFAULT_MAX_HOSTS = 10;

    public final int connectTimeoutMillis;
    // Upper bound for one request including reading the response; 0 disables it.
    public final int requestTimeoutMillis;
    // Hosts tried for one request before giving up.
    public final int maxHosts;
    public final boolean useManualAddress;

    private ClientOptions(Builder b) {
        this.connectTimeoutMillis = b.connectTimeoutMillis;
        this.requestTimeoutMillis = b.requestTimeoutMillis;
        this.maxHosts = b.maxHosts;
        this.useManualAddress = b.useManualAddress;
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
        private int requestTimeoutMillis = DEFAULT_REQUEST_TIMEOUT_MILLIS;
        private int maxHosts = DEFAULT_MAX_HOSTS;
        private boolean useManualAddress = false;

        public Builder connectTimeoutMillis(int millis) {
            this.connectTimeoutMillis = millis;
            return this;
        }

        public Builder requestTimeoutMillis(int millis) {
            this.requestTimeoutMillis = millis;
            return this;
        }

        public Builder maxHosts(int maxHosts) {
            if (maxHosts <= 0) {
                throw new IllegalArgumentException("maxHosts must be positive: " + maxHosts);
            }
            this.maxHosts = maxHosts;
            return this;
        }

        public Builder useManualAddress(boolean useManualAddress) {
            this.useManualAddress = useManualAddress;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
