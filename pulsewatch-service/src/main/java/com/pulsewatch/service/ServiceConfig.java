package com.pulsewatch.service;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable process configuration for the Pulsewatch service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaMetricsTopic;
    private final String kafkaAlertsTopic;
    private final String kafkaGroupId;
    private final boolean kafkaIngestEnabled;

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------
    private final String rulesConfigPath;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.kafkaAlertsTopic = b.kafkaAlertsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.kafkaIngestEnabled = b.kafkaIngestEnabled;
        this.rulesConfigPath = b.rulesConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", "metrics"))
                    .kafkaAlertsTopic(env("KAFKA_ALERTS_TOPIC", "alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "pulsewatch"))
                    .kafkaIngestEnabled(Boolean.parseBoolean(env("KAFKA_INGEST_ENABLED", "true")))
                    .rulesConfigPath(env("PULSEWATCH_RULES_PATH", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Consumer properties for the metrics topic: string keys, raw JSON values.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.setProperty(ConsumerConfig.GROUP_ID_CONFIG, kafkaGroupId);
        props.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.setProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.setProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        return props;
    }

    /**
     * Producer properties for the alerts topic.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.setProperty(ProducerConfig.ACKS_CONFIG, "all");
        props.setProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.setProperty(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public String getKafkaAlertsTopic() {
        return kafkaAlertsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public boolean isKafkaIngestEnabled() {
        return kafkaIngestEnabled;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that the port is in [1, 65535] and that topic
     * and group names are not blank.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaMetricsTopic = "metrics";
        private String kafkaAlertsTopic = "alerts";
        private String kafkaGroupId = "pulsewatch";
        private boolean kafkaIngestEnabled = true;
        private String rulesConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder kafkaAlertsTopic(String v) {
            this.kafkaAlertsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder kafkaIngestEnabled(boolean v) {
            this.kafkaIngestEnabled = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            requireNonBlank(kafkaAlertsTopic, "kafkaAlertsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (rulesConfigPath == null) {
                rulesConfigPath = "";
            }
            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", kafkaAlertsTopic='" + kafkaAlertsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", kafkaIngestEnabled=" + kafkaIngestEnabled +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
