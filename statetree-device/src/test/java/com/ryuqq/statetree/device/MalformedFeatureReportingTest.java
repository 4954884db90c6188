package com.ryuqq.statetree.device;

import com.ryuqq.statetree.core.event.ErrorObserver;
import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.exception.MalformedEntryException;
import com.ryuqq.statetree.core.tree.RootModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

/**
 * A feature record without a key is skipped and reported; the rest of the registration applies.
 *
 * @author StateTree Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MalformedFeatureReportingTest {

    @Mock
    private ErrorObserver errorObserver;

    private RootModel spark;
    private Device device;

    @BeforeEach
    void setUp() {
        ErrorObservers.set(errorObserver);
        spark = new RootModel("spark");
        device = new Device(spark);
    }

    @AfterEach
    void tearDown() {
        spark.close();
        ErrorObservers.reset();
    }

    @Test
    void registration_WithKeylessFeature_ReportsAndAppliesRest() {
        // Given
        Map<String, Object> body = DeviceFixtures.body();
        DeviceFixtures.developer(body).add(0, Map.of("val", "true"));

        // When
        device.processRegistrationSuccess(body);

        // Then
        assertThat(device.features().developer().keys())
            .containsExactly("console", "feature-flag", "rollout-percentage");
        assertThat(device.isRegistered()).isTrue();

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(errorObserver).onError(isNull(), error.capture());
        assertThat(error.getValue()).isInstanceOf(MalformedEntryException.class);
        MalformedEntryException malformed = (MalformedEntryException) error.getValue();
        assertThat(malformed.getIndex()).isZero();
        assertThat(malformed.getCollectionPath().toString()).isEqualTo("device.features.developer");
    }
}
