package com.sponsorsync.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FlywayConfigProperties}: construction and defaults.
 */
@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("exposes all fields")
        void exposesAllFields() {
            var props =
                    new FlywayConfigProperties(
                            "jdbc:postgresql://localhost:5432/sponsorsync",
                            "sponsorsync",
                            "secret",
                            "classpath:db/migration/custom",
                            true);

            assertThat(props.url()).isEqualTo("jdbc:postgresql://localhost:5432/sponsorsync");
            assertThat(props.username()).isEqualTo("sponsorsync");
            assertThat(props.password()).isEqualTo("secret");
            assertThat(props.locations()).isEqualTo("classpath:db/migration/custom");
            assertThat(props.enabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("missing locations fall back to the bundled scripts")
        void defaultLocations() {
            var props = new FlywayConfigProperties("jdbc:h2:mem:x", "sa", "", null, false);
            assertThat(props.locations()).isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
        }

        @Test
        @DisplayName("blank locations fall back to the bundled scripts")
        void blankLocations() {
            var props = new FlywayConfigProperties("jdbc:h2:mem:x", "sa", "", "  ", false);
            assertThat(props.locations()).isEqualTo("classpath:db/migration/sponsorsync");
        }
    }
}
