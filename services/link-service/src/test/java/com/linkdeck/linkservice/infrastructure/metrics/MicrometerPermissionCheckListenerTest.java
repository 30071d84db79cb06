package com.linkdeck.linkservice.infrastructure.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkdeck.observability.MetricFactory;
import com.linkdeck.security.PermissionCheck;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MicrometerPermissionCheckListener")
class MicrometerPermissionCheckListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerPermissionCheckListener listener =
            new MicrometerPermissionCheckListener(new MetricFactory(registry, "link-service"));

    @Test
    @DisplayName("counts checks by result and memo usage")
    void countsChecks() {
        listener.onCheck(new PermissionCheck("cards.read", true, false, Duration.ofMillis(2), false));
        listener.onCheck(new PermissionCheck("cards.read", true, true, Duration.ofMillis(1), false));
        listener.onCheck(new PermissionCheck("org.delete", false, true, Duration.ofMillis(1), false));

        assertThat(registry.get(MicrometerPermissionCheckListener.CHECKS)
                .tag("result", "granted").tag("memo", "miss").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerPermissionCheckListener.CHECKS)
                .tag("result", "granted").tag("memo", "hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerPermissionCheckListener.CHECKS)
                .tag("result", "denied").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerPermissionCheckListener.DURATION)
                .tag("result", "granted").timer().count()).isEqualTo(2);
        assertThat(registry.find(MicrometerPermissionCheckListener.SLOW).counter()).isNull();
    }

    @Test
    @DisplayName("counts slow checks separately")
    void slowChecks() {
        listener.onCheck(new PermissionCheck("members.write", true, false, Duration.ofMillis(250), true));

        assertThat(registry.get(MicrometerPermissionCheckListener.SLOW).counter().count()).isEqualTo(1.0);
    }
}
