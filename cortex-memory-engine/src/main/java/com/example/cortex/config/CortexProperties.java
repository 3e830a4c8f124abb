package com.example.cortex.config;

import com.example.cortex.domain.OperationClass;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cortex")
public class CortexProperties {

    /**
     * Identifier recorded as the agent side of every stored conversation.
     */
    private String agentId = "haus-voice-agent";

    /**
     * User identifier used by callers that are not signed in.
     */
    private String anonymousUserId = "anonymous";

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final RateLimit rateLimit = new RateLimit();

    @NestedConfigurationProperty
    private final Memory memory = new Memory();

    @NestedConfigurationProperty
    private final Recall recall = new Recall();

    @NestedConfigurationProperty
    private final Housekeeping housekeeping = new Housekeeping();

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getAnonymousUserId() {
        return anonymousUserId;
    }

    public void setAnonymousUserId(String anonymousUserId) {
        this.anonymousUserId = anonymousUserId;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Memory getMemory() {
        return memory;
    }

    public Recall getRecall() {
        return recall;
    }

    public Housekeeping getHousekeeping() {
        return housekeeping;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the memory engine.
         */
        private String keyPrefix = "cortex";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic that receives memory, fact and interaction notifications for the external indexer.
         */
        private String memoryEventTopic = "cortex.memory-events";

        /**
         * Partition count used when the topic is provisioned by the application.
         */
        private int partitions = 6;

        public String getMemoryEventTopic() {
            return memoryEventTopic;
        }

        public void setMemoryEventTopic(String memoryEventTopic) {
            this.memoryEventTopic = memoryEventTopic;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }
    }

    @Validated
    public static class RateLimit {

        /**
         * Backing store for rate limit buckets.
         */
        private StoreType store = StoreType.JPA;

        private final Policy memoryOperations = new Policy(200, Duration.ofMinutes(1));

        private final Policy voiceToken = new Policy(10, Duration.ofMinutes(1));

        private final Policy recall = new Policy(600, Duration.ofMinutes(1));

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }

        public Policy getMemoryOperations() {
            return memoryOperations;
        }

        public Policy getVoiceToken() {
            return voiceToken;
        }

        public Policy getRecall() {
            return recall;
        }

        public Policy policyFor(OperationClass operationClass) {
            return switch (operationClass) {
                case MEMORY_OPERATIONS -> memoryOperations;
                case VOICE_TOKEN -> voiceToken;
                case RECALL -> recall;
            };
        }
    }

    public enum StoreType {
        JPA,
        REDIS
    }

    @Validated
    public static class Policy {

        /**
         * Maximum requests admitted for one identity inside a window.
         */
        private int maxRequests;

        /**
         * Length of the fixed counting window.
         */
        private Duration window;

        public Policy() {
        }

        public Policy(int maxRequests, Duration window) {
            this.maxRequests = maxRequests;
            this.window = window;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    @Validated
    public static class Memory {

        /**
         * Importance assigned to a newly recorded interaction.
         */
        private int defaultImportance = 50;

        public int getDefaultImportance() {
            return defaultImportance;
        }

        public void setDefaultImportance(int defaultImportance) {
            this.defaultImportance = defaultImportance;
        }
    }

    @Validated
    public static class Recall {

        /**
         * Number of candidates returned per category when the caller does not ask for a limit.
         */
        private int defaultLimit = 20;

        /**
         * Upper bound applied to caller-supplied limits.
         */
        private int maxLimit = 100;

        /**
         * Suburb preferences at or below this score are left out of recall results.
         */
        private int suburbMinimumScore = 30;

        /**
         * Maximum number of suburb preferences returned by recall.
         */
        private int suburbLimit = 10;

        /**
         * Whether recall bumps the access counter of the memories it returns.
         */
        private boolean trackAccess = true;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getSuburbMinimumScore() {
            return suburbMinimumScore;
        }

        public void setSuburbMinimumScore(int suburbMinimumScore) {
            this.suburbMinimumScore = suburbMinimumScore;
        }

        public int getSuburbLimit() {
            return suburbLimit;
        }

        public void setSuburbLimit(int suburbLimit) {
            this.suburbLimit = suburbLimit;
        }

        public boolean isTrackAccess() {
            return trackAccess;
        }

        public void setTrackAccess(boolean trackAccess) {
            this.trackAccess = trackAccess;
        }
    }

    @Validated
    public static class Housekeeping {

        /**
         * Interval between automatic housekeeping cycles.
         */
        private Duration interval = Duration.ofMinutes(10);

        /**
         * Rate limit buckets whose window started longer ago than this are deleted.
         */
        private Duration bucketRetention = Duration.ofHours(24);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getBucketRetention() {
            return bucketRetention;
        }

        public void setBucketRetention(Duration bucketRetention) {
            this.bucketRetention = bucketRetention;
        }
    }
}
