package net.tilefetch.config;

import net.tilefetch.model.RetryBudget;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TileSourcePropertiesTest {

    @Test
    void should_DefaultToThreeAttemptsWithinSixtySeconds() {
        TileSourceProperties properties = new TileSourceProperties();

        assertThat(properties.toRetryBudget()).isEqualTo(RetryBudget.defaults());
        assertThat(properties.isCacheable()).isTrue();
        assertThat(properties.isHidden()).isFalse();
        assertThat(properties.getUrlTemplates()).hasSize(1);
        assertThat(properties.getCache().getTtl()).isEqualTo(Duration.ofHours(1));
        assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    void should_RejectZeroRetryCount() {
        TileSourceProperties properties = new TileSourceProperties();
        properties.setRetryCount(0);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retry-count");
    }

    @Test
    void should_RejectNonPositiveTimeout() {
        TileSourceProperties properties = new TileSourceProperties();
        properties.setRequestTimeoutSeconds(0);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("request-timeout-seconds");
    }

    @Test
    void should_RejectMissingTemplatesAndInvertedZoomRange() {
        TileSourceProperties noTemplates = new TileSourceProperties();
        noTemplates.setUrlTemplates(List.of());
        TileSourceProperties inverted = new TileSourceProperties();
        inverted.setMinZoom(10);
        inverted.setMaxZoom(5);

        assertThatThrownBy(noTemplates::validate).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(inverted::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
