package com.tributary.connect.config;

import com.tributary.test.TestBase;
import com.tributary.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ConnectConfig Tests")
class ConnectConfigTest extends TestBase {

    private static final long MIB = 1024L * 1024;

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        ConnectConfig config = ConnectConfig.fromProperties(new Properties());

        assertThat(config.port()).isEqualTo(15002);
        assertThat(config.maxInboundMessageSize()).isEqualTo(128 * MIB);
        assertThat(config.arrowMaxBatchSize()).isEqualTo(4 * MIB);
        assertThat(config.sessionCacheSize()).isEqualTo(100);
        assertThat(config.sessionIdleTimeoutSeconds()).isEqualTo(3600);
        assertThat(config.maxErrorMessageSize()).isEqualTo(2048);
        assertThat(config.schedulerParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    @DisplayName("The encoder budget is 70% of the Arrow batch size")
    void estimatedBatchBytes() {
        ConnectConfig config = ConnectConfig.builder().build();

        assertThat(config.maxEstimatedBatchBytes()).isEqualTo((long) (4 * MIB * 0.7));
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesTests {

        @Test
        @DisplayName("Valid properties are applied")
        void validPropertiesApplied() {
            Properties props = new Properties();
            props.setProperty(ConnectConfig.PROP_PORT, "0");
            props.setProperty(ConnectConfig.PROP_MAX_INBOUND_MESSAGE_SIZE, "64m");
            props.setProperty(ConnectConfig.PROP_ARROW_MAX_BATCH_SIZE, "8");
            props.setProperty(ConnectConfig.PROP_SESSION_CACHE_SIZE, "5");
            props.setProperty(ConnectConfig.PROP_SESSION_IDLE_TIMEOUT_SECONDS, "30");
            props.setProperty(ConnectConfig.PROP_MAX_ERROR_MESSAGE_SIZE, "512");
            props.setProperty(ConnectConfig.PROP_SCHEDULER_PARALLELISM, "3");

            ConnectConfig config = ConnectConfig.fromProperties(props);

            assertThat(config.port()).isZero();
            assertThat(config.maxInboundMessageSize()).isEqualTo(64 * MIB);
            assertThat(config.arrowMaxBatchSize()).isEqualTo(8 * MIB);
            assertThat(config.sessionCacheSize()).isEqualTo(5);
            assertThat(config.sessionIdleTimeoutSeconds()).isEqualTo(30);
            assertThat(config.maxErrorMessageSize()).isEqualTo(512);
            assertThat(config.schedulerParallelism()).isEqualTo(3);
        }

        @Test
        @DisplayName("A unitless inbound size is in bytes")
        void inboundSizeDefaultsToBytes() {
            Properties props = new Properties();
            props.setProperty(ConnectConfig.PROP_MAX_INBOUND_MESSAGE_SIZE, "1048576");

            assertThat(ConnectConfig.fromProperties(props).maxInboundMessageSize()).isEqualTo(MIB);
        }

        @ParameterizedTest
        @CsvSource({
            "tributary.connect.grpc.binding.port, 70000",
            "tributary.connect.grpc.binding.port, http",
            "tributary.connect.session.cacheSize, 0",
            "tributary.connect.jvmStacktrace.maxSize, 3",
            "tributary.connect.grpc.maxInboundMessageSize, 4g",
            "tributary.connect.grpc.arrow.maxBatchSize, 4 parsecs"
        })
        @DisplayName("Invalid values fall back to the default")
        void invalidValuesFallBack(String key, String value) {
            Properties props = new Properties();
            props.setProperty(key, value);

            ConnectConfig config = ConnectConfig.fromProperties(props);

            assertThat(config.toString()).isEqualTo(ConnectConfig.builder().build().toString());
        }
    }

    @Nested
    @DisplayName("Byte sizes")
    class ByteSizeTests {

        @ParameterizedTest
        @CsvSource({
            "512, 512",
            "512b, 512",
            "2k, 2048",
            "2KiB, 2048",
            "4m, 4194304",
            "4 MB, 4194304",
            "1g, 1073741824",
            "1GiB, 1073741824"
        })
        @DisplayName("Suffixes are case-insensitive binary multiples")
        void parsesUnits(String text, long expected) {
            assertThat(ConnectConfig.parseByteSize(text, 1)).isEqualTo(expected);
        }

        @Test
        @DisplayName("The default unit applies only without a suffix")
        void defaultUnit() {
            assertThat(ConnectConfig.parseByteSize("3", MIB)).isEqualTo(3 * MIB);
            assertThat(ConnectConfig.parseByteSize("3k", MIB)).isEqualTo(3 * 1024);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "m", "-1m", "12tb"})
        @DisplayName("Malformed sizes are rejected")
        void malformedRejected(String text) {
            assertThatThrownBy(() -> ConnectConfig.parseByteSize(text, 1))
                .isInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("Overflow is reported")
        void overflow() {
            assertThatThrownBy(() -> ConnectConfig.parseByteSize("9223372036854775807g", 1))
                .isInstanceOf(ArithmeticException.class);
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Out-of-range values are rejected")
        void outOfRangeRejected() {
            assertThatThrownBy(() -> ConnectConfig.builder().port(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ConnectConfig.builder().maxInboundMessageSize(Integer.MAX_VALUE + 1L).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ConnectConfig.builder().arrowMaxBatchSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ConnectConfig.builder().maxErrorMessageSize(3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 4");
            assertThatThrownBy(() -> ConnectConfig.builder().schedulerParallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("withPort changes only the port")
        void withPort() {
            ConnectConfig base = ConnectConfig.builder().sessionCacheSize(7).build();

            ConnectConfig moved = base.withPort(0);

            assertThat(moved.port()).isZero();
            assertThat(moved.sessionCacheSize()).isEqualTo(7);
        }
    }
}
