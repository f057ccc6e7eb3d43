package com.bizpulse.anomaly.repository;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static com.bizpulse.anomaly.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertHistoryRepositoryTest {

    @Mock
    private MetricsConfig metricsConfig;

    private AlertHistoryRepository repository(int maxHistory) {
        AlertingProperties properties = new AlertingProperties();
        properties.setMaxHistory(maxHistory);
        return new AlertHistoryRepository(properties, metricsConfig);
    }

    @Test
    void overCapacity_evictsOldestHandledFirst() {
        AlertHistoryRepository repository = repository(3);
        Alert a1 = TestDataFactory.createAlert("ALERT_1", Severity.LOW, T0);
        Alert a2 = TestDataFactory.createAlert("ALERT_2", Severity.LOW, T0);
        Alert a3 = TestDataFactory.createAlert("ALERT_3", Severity.LOW, T0);
        a2.markHandled(T0);
        repository.save(a1);
        repository.save(a2);
        repository.save(a3);

        repository.save(TestDataFactory.createAlert("ALERT_4", Severity.LOW, T0));

        assertThat(repository.count()).isEqualTo(3);
        assertThat(repository.findById("ALERT_2")).isEmpty();
        assertThat(repository.findById("ALERT_1")).contains(a1);
        verify(metricsConfig).recordEviction(true);
        verify(metricsConfig, never()).recordEviction(false);
    }

    @Test
    void overCapacityWithNothingHandled_evictsOldest() {
        AlertHistoryRepository repository = repository(2);
        repository.save(TestDataFactory.createAlert("ALERT_1", Severity.LOW, T0));
        repository.save(TestDataFactory.createAlert("ALERT_2", Severity.LOW, T0));
        repository.save(TestDataFactory.createAlert("ALERT_3", Severity.LOW, T0));

        assertThat(repository.findAll()).extracting(Alert::getAlertId).containsExactly("ALERT_2", "ALERT_3");
        verify(metricsConfig).recordEviction(false);
    }

    @Test
    void find_filtersBySinceAndCurrentSeverity() {
        AlertHistoryRepository repository = repository(10);
        Alert early = TestDataFactory.createAlert("ALERT_1", Severity.LOW, T0);
        Alert late = TestDataFactory.createAlert("ALERT_2", Severity.LOW, T0.plus(Duration.ofHours(2)));
        repository.save(early);
        repository.save(late);
        early.escalateTo(Severity.MEDIUM);

        assertThat(repository.find(T0.plus(Duration.ofHours(1)), null)).containsExactly(late);
        assertThat(repository.find(null, Severity.MEDIUM)).containsExactly(early);
        assertThat(repository.find(null, null)).containsExactly(early, late);
    }

    @Test
    void unhandledViews_trackAcknowledgement() {
        AlertHistoryRepository repository = repository(10);
        Alert a1 = TestDataFactory.createAlert("ALERT_1", Severity.HIGH, T0);
        Alert a2 = TestDataFactory.createAlert("ALERT_2", Severity.HIGH, T0);
        repository.save(a1);
        repository.save(a2);

        a1.markHandled(T0);

        assertThat(repository.findUnhandled()).containsExactly(a2);
        assertThat(repository.countUnhandled()).isEqualTo(1);
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    void nonPositiveCapacity_isRejected() {
        assertThatThrownBy(() -> repository(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
