package com.pulsewatch.service;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should apply defaults for unset values")
    void shouldApplyDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaMetricsTopic()).isEqualTo("metrics");
        assertThat(config.getKafkaAlertsTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("pulsewatch");
        assertThat(config.isKafkaIngestEnabled()).isTrue();
        assertThat(config.getRulesConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should build consumer properties for raw JSON values")
    void shouldBuildConsumerProperties() {
        ServiceConfig config = new ServiceConfig.Builder()
                .kafkaBootstrapServers("broker:29092")
                .kafkaGroupId("pw-test")
                .build();

        Properties props = config.kafkaConsumerProperties();

        assertThat(props.getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker:29092");
        assertThat(props.getProperty(ConsumerConfig.GROUP_ID_CONFIG)).isEqualTo("pw-test");
        assertThat(props.getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG)).isEqualTo("earliest");
        assertThat(props.getProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG))
                .isEqualTo(ByteArrayDeserializer.class.getName());
    }

    @Test
    @DisplayName("Should build producer properties that wait for all replicas")
    void shouldBuildProducerProperties() {
        Properties props = new ServiceConfig.Builder().build().kafkaProducerProperties();

        assertThat(props.getProperty(ProducerConfig.ACKS_CONFIG)).isEqualTo("all");
        assertThat(props.getProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG))
                .isEqualTo(StringSerializer.class.getName());
    }

    @Test
    @DisplayName("Should reject a health port out of range")
    void shouldRejectPort() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject blank topic names")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().kafkaMetricsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaMetricsTopic");
    }
}
